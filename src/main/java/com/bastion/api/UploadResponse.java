package com.bastion.api;

import com.bastion.domain.UploadResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of a multi-file upload response, one result per submitted file
 */
public class UploadResponse {

    @JsonProperty("results")
    private final List<UploadResult> results;

    public UploadResponse(List<UploadResult> results) {
        this.results = List.copyOf(results);
    }

    public List<UploadResult> getResults() {
        return results;
    }
}
