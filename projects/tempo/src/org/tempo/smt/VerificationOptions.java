package org.tempo.smt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.tempo.common.TempoException;

/**
 * Settings of a verification run. Options are immutable; the
 * {@code with} methods return modified copies.
 */
public class VerificationOptions {

    private static final String PRINT_FORMULAS_VAR = "printFormulas";

    private static final String PARALLELISM_VAR = "parallelism";

    private static final String TRACK_UNSAT_CORE_VAR = "trackUnsatCore";

    public static final VerificationOptions DEFAULT = new VerificationOptions(false, null, false);

    private final boolean _printFormulas;

    private final int _parallelism;

    private final boolean _trackUnsatCore;

    /**
     * @param printFormulas  Log every query before solving it
     * @param parallelism  The number of worker threads; the number of
     *                     available processors when null
     * @param trackUnsatCore  Track the conjuncts of every query and log
     *                        the unsat core of proved queries
     */
    @JsonCreator
    public VerificationOptions(
            @JsonProperty(PRINT_FORMULAS_VAR) boolean printFormulas,
            @JsonProperty(PARALLELISM_VAR) Integer parallelism,
            @JsonProperty(TRACK_UNSAT_CORE_VAR) boolean trackUnsatCore) {
        _printFormulas = printFormulas;
        _parallelism = parallelism == null ? Runtime.getRuntime().availableProcessors() : parallelism;
        if (_parallelism < 1) {
            throw new TempoException("parallelism must be positive, got " + _parallelism);
        }
        _trackUnsatCore = trackUnsatCore;
    }

    @JsonProperty(PRINT_FORMULAS_VAR)
    public boolean getPrintFormulas() {
        return _printFormulas;
    }

    @JsonProperty(PARALLELISM_VAR)
    public int getParallelism() {
        return _parallelism;
    }

    @JsonProperty(TRACK_UNSAT_CORE_VAR)
    public boolean getTrackUnsatCore() {
        return _trackUnsatCore;
    }

    public VerificationOptions withPrintFormulas(boolean printFormulas) {
        return new VerificationOptions(printFormulas, _parallelism, _trackUnsatCore);
    }

    public VerificationOptions withParallelism(int parallelism) {
        return new VerificationOptions(_printFormulas, parallelism, _trackUnsatCore);
    }

    public VerificationOptions withTrackUnsatCore(boolean trackUnsatCore) {
        return new VerificationOptions(_printFormulas, _parallelism, trackUnsatCore);
    }

    @Override
    public String toString() {
        return "VerificationOptions{printFormulas=" + _printFormulas + ", parallelism="
                + _parallelism + ", trackUnsatCore=" + _trackUnsatCore + "}";
    }
}
