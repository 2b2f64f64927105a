package dev.harvester.sink;

import dev.harvester.extract.Member;
import java.nio.file.Path;

/**
 * Persists a member as an artifact keyed by its identity.
 *
 * <p>Callers guarantee at most one call per identity; implementations overwrite on repeat.
 */
public interface MemberSink {

    /**
     * Convert and store a member.
     *
     * @param member the member with identity, payload and inherited context
     * @return path of the written artifact
     * @throws ConversionException if the payload cannot be converted or written
     */
    Path persist(Member member);
}
