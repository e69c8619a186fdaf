package com.phillippitts.speaktorobot.service.extraction;

import com.phillippitts.speaktorobot.domain.ExtractionResult;
import com.phillippitts.speaktorobot.domain.RequestContext;

/**
 * Bounded call/validate/feedback loop against the language model.
 *
 * <p>Implementations append every attempt to the supplied {@link RequestContext} and complete it
 * with the terminal {@link ExtractionResult}. Language-model failures are not a result: they
 * propagate as {@link com.phillippitts.speaktorobot.exception.UpstreamServiceException} and are
 * never retried. Interruption of the calling thread ends the loop with
 * {@link com.phillippitts.speaktorobot.exception.RequestCancelledException}.
 */
public interface ExtractionRetryLoop {

    /**
     * @param context request-confined context (not yet completed)
     * @return terminal result, also recorded on the context
     */
    ExtractionResult run(RequestContext context);
}
