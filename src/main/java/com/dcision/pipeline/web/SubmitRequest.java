package com.dcision.pipeline.web;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitRequest {
    private String text;
    private Map<String, String> hints; // optional: units, horizon, ...
}
