package org.calista.formal.lang.eval;

import org.calista.formal.lang.FormalException;

public class EvaluationException extends FormalException {

    public EvaluationException(String message) {
        super(message);
    }
}
