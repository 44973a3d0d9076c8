package com.eia.api.query;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eia.api.exceptions.InvalidArgumentException;

/**
 * Splits a range into request sized, contiguous, non-overlapping chunks.
 * <p>
 * Starting at {@code start}, the cursor advances {@code periodsPerChunk} units at a
 * time. While the advanced point is strictly before {@code end} it opens the next
 * chunk and the current chunk closes one unit before it, so no period is requested
 * twice. Otherwise the current chunk closes at exactly {@code end}.
 */
public final class ChunkPlanner {

    private static final Logger logger = LoggerFactory.getLogger(ChunkPlanner.class);

    private ChunkPlanner() {
    }

    /**
     * @param range           full range to cover
     * @param periodsPerChunk target number of periods per chunk, must be positive
     * @return chunks in range order, indexed from 0
     */
    public static List<Chunk> plan(TimeRange range, int periodsPerChunk) {
        if (range == null) {
            throw new InvalidArgumentException("Range must not be null");
        }
        if (periodsPerChunk <= 0) {
            throw new InvalidArgumentException("Periods per chunk must be positive, got: " + periodsPerChunk);
        }

        Granularity granularity = range.getGranularity();
        LocalDateTime end = range.getEnd();
        List<Chunk> chunks = new ArrayList<>();

        LocalDateTime chunkStart = range.getStart();
        while (true) {
            LocalDateTime next = granularity.plus(chunkStart, periodsPerChunk);
            if (next.isBefore(end)) {
                LocalDateTime chunkEnd = granularity.plus(next, -1);
                chunks.add(new Chunk(chunks.size(), TimeRange.of(chunkStart, chunkEnd, granularity)));
                chunkStart = next;
            } else {
                chunks.add(new Chunk(chunks.size(), TimeRange.of(chunkStart, end, granularity)));
                break;
            }
        }

        logger.debug("Planned {} chunk(s) of up to {} {} for {} ({} periods)",
                chunks.size(), periodsPerChunk, granularity.getUnit(), range, range.periodCount());
        return Collections.unmodifiableList(chunks);
    }
}
