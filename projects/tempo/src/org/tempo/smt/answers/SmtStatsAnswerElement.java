package org.tempo.smt.answers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.tempo.smt.VerificationResult;
import org.tempo.smt.VerificationStats;

/**
 * The result of a check together with its timing.
 */
public class SmtStatsAnswerElement extends SmtCheckAnswerElement {

    private static final String STATISTICS_VAR = "statistics";

    private VerificationStats _statistics;

    @JsonCreator
    public SmtStatsAnswerElement(
            @JsonProperty("result") VerificationResult result,
            @JsonProperty(STATISTICS_VAR) VerificationStats statistics) {
        super(result);
        _statistics = statistics;
    }

    @JsonProperty(STATISTICS_VAR)
    public VerificationStats getStatistics() {
        return _statistics;
    }

    @Override
    public String prettyPrint() throws JsonProcessingException {
        return super.prettyPrint() + "\n" + _statistics;
    }
}
