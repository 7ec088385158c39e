package io.jobs4j.core;

public enum JobStatus {
    PENDING {
        @Override
        public boolean isFinished() {
            return false;
        }
    },
    RUNNING {
        @Override
        public boolean isFinished() {
            return false;
        }
    },
    COMPLETED {
        @Override
        public boolean isFinished() {
            return true;
        }
    },
    FAILED {
        @Override
        public boolean isFinished() {
            return true;
        }
    },
    STALLED {
        @Override
        public boolean isFinished() {
            return false;
        }
    };

    public abstract boolean isFinished();
}
