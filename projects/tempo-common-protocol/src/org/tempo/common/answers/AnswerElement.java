package org.tempo.common.answers;

import com.fasterxml.jackson.core.JsonProcessingException;

public interface AnswerElement {

   /**
    * A human-readable rendering of this answer.
    */
   String prettyPrint() throws JsonProcessingException;

}
