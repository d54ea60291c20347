package io.jobqueue.util;

import com.github.f4b6a3.ulid.UlidCreator;

/**
 * Job id generation. Ids are monotonic ULIDs: lexicographic order equals creation order
 * within a process, which gives claims their insertion-order tie-break.
 */
public final class JobIds {

    private JobIds() {
    }

    public static String next() {
        return UlidCreator.getMonotonicUlid().toString();
    }
}
