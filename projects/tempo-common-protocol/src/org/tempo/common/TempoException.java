package org.tempo.common;

/**
 * Thrown for every infrastructure failure: malformed definitions, solver
 * results that are neither satisfiable nor unsatisfiable, and errors raised
 * while a check was running on a worker thread.
 */
public class TempoException extends RuntimeException {

   private static final long serialVersionUID = 1L;

   public TempoException(String msg) {
      super(msg);
   }

   public TempoException(String msg, Throwable cause) {
      super(msg, cause);
   }

}
