package de.caluga.solo;

/**
 * Source of participant identities. Ids must be collision resistant across all
 * participants sharing a store; they are treated as opaque strings.
 */
@FunctionalInterface
public interface IdGenerator {
    String generate();
}
