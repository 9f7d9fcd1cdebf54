package de.bsommerfeld.redditindexer.core.domain;

/**
 * The two item streams harvested per channel. Each kind is stored in its own
 * collection; the prefix is part of the collection name.
 */
public enum ItemKind {

    SUBMISSIONS("subm__"),
    COMMENTS("comm__");

    private final String collectionPrefix;

    ItemKind(String collectionPrefix) {
        this.collectionPrefix = collectionPrefix;
    }

    public String collectionPrefix() {
        return collectionPrefix;
    }
}
