package com.siteintel.scrape.model;

import java.util.List;

public record ContactInfo(
    List<String> emails,
    List<String> phones,
    List<String> addresses
) {
    public ContactInfo {
        emails = emails == null ? List.of() : List.copyOf(emails);
        phones = phones == null ? List.of() : List.copyOf(phones);
        addresses = addresses == null ? List.of() : List.copyOf(addresses);
    }

    public static ContactInfo empty() {
        return new ContactInfo(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return emails.isEmpty() && phones.isEmpty() && addresses.isEmpty();
    }
}
