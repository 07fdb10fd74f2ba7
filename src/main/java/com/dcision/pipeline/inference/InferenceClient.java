package com.dcision.pipeline.inference;

import com.dcision.pipeline.exception.InferenceException;

/**
 * One prompt+schema request to a named model in a named region. The returned payload is
 * untrusted text; callers extract and validate it.
 */
public interface InferenceClient {

    /**
     * @throws InferenceException with kind Timeout, RateLimited, BackendUnavailable or MalformedResponse
     */
    InferenceResponse complete(InferenceRequest request);
}
