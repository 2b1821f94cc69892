package org.tempo.smt;


import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

public class VerificationResult {

    private static final String VERIFIED_VAR = "verified";

    private static final String COUNTEREXAMPLE_VAR = "counterexample";

    private boolean _verified;

    private State _counterexample;

    @JsonCreator
    public VerificationResult(
            @JsonProperty(VERIFIED_VAR) boolean verified,
            @JsonProperty(COUNTEREXAMPLE_VAR) State counterexample) {
        _verified = verified;
        _counterexample = counterexample;
    }

    /**
     * The result of a check: verified exactly when there is no counterexample.
     */
    public static VerificationResult of(Optional<State> counterexample) {
        return new VerificationResult(!counterexample.isPresent(), counterexample.orElse(null));
    }

    @JsonProperty(VERIFIED_VAR)
    public boolean getVerified() {
        return _verified;
    }

    @JsonProperty(COUNTEREXAMPLE_VAR)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public State getCounterexample() {
        return _counterexample;
    }

    public String prettyPrint() {
        if (_verified) {
            return "verified";
        }
        return _counterexample.prettyPrint();
    }
}
