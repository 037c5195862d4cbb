package com.siteintel.scrape.robots;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Allow/disallow rules for the wildcard user agent plus every declared sitemap.
 */
public class RobotsRules {
  private final List<Rule> rules;
  private final List<String> sitemapUrls;

  public RobotsRules(List<Rule> rules, List<String> sitemapUrls) {
    this.rules = List.copyOf(rules);
    this.sitemapUrls = List.copyOf(sitemapUrls);
  }

  public static RobotsRules allowAll() {
    return new RobotsRules(List.of(), List.of());
  }

  public List<String> getSitemapUrls() {
    return sitemapUrls;
  }

  public boolean isAllowed(String pathAndQuery) {
    if (rules.isEmpty()) {
      return true;
    }
    String subject = pathAndQuery == null || pathAndQuery.isBlank() ? "/" : pathAndQuery;
    Rule winner = null;
    for (Rule rule : rules) {
      if (!rule.matches(subject)) {
        continue;
      }
      if (winner == null
          || rule.path().length() > winner.path().length()
          || (rule.path().length() == winner.path().length() && rule.allow() && !winner.allow())) {
        winner = rule;
      }
    }
    return winner == null || winner.allow();
  }

  public static RobotsRules parse(String robotsText) {
    if (robotsText == null || robotsText.isBlank()) {
      return allowAll();
    }

    List<String> sitemaps = new ArrayList<>();
    List<Rule> parsedRules = new ArrayList<>();
    boolean wildcardGroup = false;
    boolean inAgentRun = false;

    for (String rawLine : robotsText.split("\\R")) {
      int hash = rawLine.indexOf('#');
      String line = (hash >= 0 ? rawLine.substring(0, hash) : rawLine).trim();
      if (line.isEmpty()) {
        continue;
      }
      int colon = line.indexOf(':');
      if (colon <= 0) {
        continue;
      }
      String directive = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
      String value = line.substring(colon + 1).trim();

      switch (directive) {
        case "user-agent" -> {
          boolean wildcard = "*".equals(value);
          wildcardGroup = inAgentRun ? wildcardGroup || wildcard : wildcard;
          inAgentRun = true;
        }
        case "sitemap" -> {
          inAgentRun = false;
          if (!value.isBlank()) {
            sitemaps.add(value);
          }
        }
        case "allow", "disallow" -> {
          inAgentRun = false;
          if (wildcardGroup && !value.isBlank()) {
            parsedRules.add(new Rule(value, "allow".equals(directive)));
          }
        }
        default -> inAgentRun = false;
      }
    }
    return new RobotsRules(parsedRules, sitemaps);
  }

  public record Rule(String path, boolean allow) {
    public boolean matches(String testPath) {
      String pattern = path.startsWith("/") ? path : "/" + path;
      if (pattern.indexOf('*') < 0 && pattern.indexOf('$') < 0) {
        return testPath.startsWith(pattern);
      }
      StringBuilder regex = new StringBuilder("^");
      for (char c : pattern.toCharArray()) {
        if (c == '*') {
          regex.append(".*");
        } else if (c == '$') {
          regex.append('$');
        } else {
          regex.append(Pattern.quote(String.valueOf(c)));
        }
      }
      return Pattern.compile(regex.toString()).matcher(testPath).find();
    }
  }
}
