package com.dcision.pipeline.cache;

import com.dcision.pipeline.config.PipelineJson;
import com.dcision.pipeline.domain.StageName;
import com.dcision.pipeline.exception.ErrorKind;
import com.dcision.pipeline.exception.PipelineException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic cache key of a stage invocation: SHA-256 over the canonical JSON of the
 * stage name, its semantically relevant inputs and its parameters.
 */
@Component
public class Fingerprinter {

    private final ObjectMapper canonical = PipelineJson.canonicalMapper();

    public String fingerprint(StageName stage, Object inputs, Map<String, ?> parameters) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("stage", stage);
        document.put("inputs", inputs);
        document.put("parameters", parameters);
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(canonical.writeValueAsBytes(document));
            return stage.wireName() + ":" + HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException e) {
            throw new PipelineException(ErrorKind.INTERNAL, "Cannot fingerprint " + stage.wireName() + " inputs", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
