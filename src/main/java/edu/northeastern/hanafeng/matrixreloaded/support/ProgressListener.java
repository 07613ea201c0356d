package edu.northeastern.hanafeng.matrixreloaded.support;

/**
 * Observer of long-running simulation phases. Implementations must not block
 * and must not influence control flow.
 */
public interface ProgressListener {

    ProgressListener NONE = new ProgressListener() {
        @Override
        public void started(String phase, long total) {
        }

        @Override
        public void advanced(String phase, long delta) {
        }

        @Override
        public void finished(String phase) {
        }
    };

    void started(String phase, long total);

    void advanced(String phase, long delta);

    void finished(String phase);
}
