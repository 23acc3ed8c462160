package de.caluga.solo;

import org.bson.types.ObjectId;

/**
 * Default identities: {@code participant-} followed by a fresh ObjectId
 * (timestamp, machine and process part, counter).
 */
public class ObjectIdGenerator implements IdGenerator {
    public static final String PREFIX = "participant-";

    @Override
    public String generate() {
        return PREFIX + new ObjectId().toHexString();
    }
}
