package org.tempo.smt.answers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.tempo.common.answers.AnswerElement;
import org.tempo.smt.State;
import org.tempo.smt.VerificationResult;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The result of a check at every node.
 */
public class SmtNodesAnswerElement implements AnswerElement {

    private static final String RESULT_VAR = "result";

    protected Map<String, VerificationResult> _result;

    @JsonCreator
    public SmtNodesAnswerElement(@JsonProperty(RESULT_VAR) Map<String, VerificationResult> result) {
        _result = result;
    }

    public static SmtNodesAnswerElement fromStates(Map<String, Optional<State>> states) {
        Map<String, VerificationResult> result = new LinkedHashMap<>();
        states.forEach((node, state) -> result.put(node, VerificationResult.of(state)));
        return new SmtNodesAnswerElement(result);
    }

    @JsonProperty(RESULT_VAR)
    public Map<String, VerificationResult> getResult() {
        return _result;
    }

    @JsonIgnore
    public boolean getVerified() {
        for (VerificationResult r : _result.values()) {
            if (!r.getVerified()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String prettyPrint() throws JsonProcessingException {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, VerificationResult> e : _result.entrySet()) {
            VerificationResult r = e.getValue();
            if (!r.getVerified()) {
                sb.append(r.prettyPrint());
            }
        }
        if (sb.length() == 0) {
            return "verified";
        }
        return sb.toString();
    }
}
