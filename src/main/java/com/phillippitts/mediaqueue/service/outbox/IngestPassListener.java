package com.phillippitts.mediaqueue.service.outbox;

/**
 * Batched signal fired once at the end of every drain pass.
 */
@FunctionalInterface
public interface IngestPassListener {

    IngestPassListener NO_OP = stats -> { };

    void onPass(PassStats stats);

    /**
     * Counts for one drain pass.
     *
     * @param succeeded entries removed after a successful ingest
     * @param failed    entries whose ingest failed or threw
     */
    record PassStats(int succeeded, int failed) {

        public int processed() {
            return succeeded + failed;
        }
    }
}
