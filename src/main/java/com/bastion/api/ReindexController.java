package com.bastion.api;

import com.bastion.domain.UploadResult;
import com.bastion.ingestion.ReindexRequest;
import com.bastion.ingestion.ReindexService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reprocess a stored upload from its retained raw content.
 *
 * Failures map through {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/reindex")
public class ReindexController {

    private final ReindexService reindexService;

    public ReindexController(ReindexService reindexService) {
        this.reindexService = reindexService;
    }

    @PostMapping
    public UploadResult reindex(@RequestBody ReindexRequest request) {
        return reindexService.reindex(request);
    }
}
