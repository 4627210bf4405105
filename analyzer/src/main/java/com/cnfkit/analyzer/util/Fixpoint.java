package com.cnfkit.analyzer.util;

/**
 * Repeats a monotone update until it stops changing anything. The pass cap only guards against
 * modelling errors; a correct monotone pass converges well before it.
 */
public final class Fixpoint {

    private Fixpoint() {}

    public interface Pass {
        /** Runs one pass and reports whether anything changed. */
        boolean run();
    }

    /** Returns the number of passes executed, including the final unchanged one. */
    public static int iterate(String name, int maxPasses, Pass pass) {
        for (int i = 1; i <= maxPasses; i++) {
            if (!pass.run()) {
                return i;
            }
        }
        throw new IllegalStateException(name + " did not converge within " + maxPasses + " passes");
    }
}
