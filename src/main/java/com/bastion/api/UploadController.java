package com.bastion.api;

import com.bastion.domain.Upload;
import com.bastion.domain.UploadResult;
import com.bastion.ingestion.UploadService;
import com.bastion.storage.UploadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * File upload and upload listing
 */
@RestController
@RequestMapping("/api")
public class UploadController {
    private static final Logger logger = LoggerFactory.getLogger(UploadController.class);

    private final UploadService uploadService;
    private final UploadRepository uploadRepository;

    public UploadController(UploadService uploadService, UploadRepository uploadRepository) {
        this.uploadService = uploadService;
        this.uploadRepository = uploadRepository;
    }

    /**
     * POST /api/upload with one or more multipart parts named "files"
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Object> upload(@RequestParam(value = "files", required = false) List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            return ResponseEntity.badRequest().body(new ErrorResponse("No files provided", null));
        }

        logger.info("Received upload request with {} file(s)", files.size());
        List<UploadResult> results = uploadService.processFiles(files);
        return ResponseEntity.ok(new UploadResponse(results));
    }

    @GetMapping("/uploads")
    public List<Upload> listUploads() {
        return uploadRepository.findAll();
    }
}
