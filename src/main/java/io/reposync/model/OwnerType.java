package io.reposync.model;

public enum OwnerType {
    SITE("site"),
    USER("user"),
    ORG("org");

    private final String label;

    OwnerType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
