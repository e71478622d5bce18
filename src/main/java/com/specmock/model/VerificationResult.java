package com.specmock.model;

/**
 * Outcome of verifying a request against its operation: either it passed, or it failed with
 * the status whose example should be returned.
 */
public sealed interface VerificationResult permits VerificationResult.Passed, VerificationResult.Failed {

    static VerificationResult passed() {
        return Passed.INSTANCE;
    }

    static VerificationResult failed(int status, String exampleName) {
        return new Failed(status, exampleName);
    }

    default boolean isPassed() {
        return this instanceof Passed;
    }

    final class Passed implements VerificationResult {

        private static final Passed INSTANCE = new Passed();

        private Passed() {
        }

        @Override
        public String toString() {
            return "Passed";
        }
    }

    /**
     * @param status      The HTTP status to answer with (400 or 401).
     * @param exampleName The explicitly requested example name, or {@code null}.
     */
    record Failed(int status, String exampleName) implements VerificationResult {
    }
}
