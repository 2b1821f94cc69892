package org.tempo.smt.answers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.tempo.common.answers.AnswerElement;
import org.tempo.smt.VerificationResult;

/**
 * The result of a single check.
 */
public class SmtCheckAnswerElement implements AnswerElement {

    private static final String RESULT_VAR = "result";

    protected VerificationResult _result;

    @JsonCreator
    public SmtCheckAnswerElement(@JsonProperty(RESULT_VAR) VerificationResult result) {
        _result = result;
    }

    @JsonProperty(RESULT_VAR)
    public VerificationResult getResult() {
        return _result;
    }

    @Override
    public String prettyPrint() throws JsonProcessingException {
        return _result.prettyPrint();
    }
}
