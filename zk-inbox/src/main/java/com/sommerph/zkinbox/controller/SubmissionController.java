package com.sommerph.zkinbox.controller;

import com.sommerph.zkinbox.model.encryption.KeyValidation;
import com.sommerph.zkinbox.model.submission.SubmissionIntake;
import com.sommerph.zkinbox.model.submission.SubmissionResult;
import com.sommerph.zkinbox.service.encryption.HybridEncryptionService;
import com.sommerph.zkinbox.service.nullifier.NullifierService;
import com.sommerph.zkinbox.service.submission.SubmissionPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/submissions")
@RequiredArgsConstructor
@Tag(name = "Submissions", description = "Anonymous report intake")
public class SubmissionController {

    private final SubmissionPipeline submissionPipeline;
    private final NullifierService nullifierService;
    private final HybridEncryptionService encryptionService;

    @Operation(summary = "Submit an encrypted report with its membership proof")
    @PostMapping
    public ResponseEntity<?> submit(@RequestBody @Valid SubmissionIntake intake) {
        log.info("Receive submission");
        try {
            SubmissionResult result = submissionPipeline.accept(intake);
            if (result.isAccepted()) {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("success", true);
                body.put("id", result.getRecord().getId());
                return ResponseEntity.status(HttpStatus.CREATED).body(body);
            }
            HttpStatus status = result.getReason().isUserVisible() ? HttpStatus.CONFLICT : HttpStatus.BAD_REQUEST;
            return ResponseEntity.status(status).body(Map.of("success", false, "error", result.userMessage()));
        } catch (Exception e) {
            log.error("Submission intake failed", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("success", false, "error", SubmissionResult.GENERIC_FAILURE_MESSAGE));
        }
    }

    @Operation(summary = "Get the current epoch and its duration")
    @GetMapping("/epoch")
    public ResponseEntity<?> currentEpoch() {
        long epoch = nullifierService.currentEpoch();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("epoch", epoch);
        body.put("durationSeconds", nullifierService.epochDurationSeconds());
        body.put("startsAt", nullifierService.epochStart(epoch).toString());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Validate a recipient public key")
    @PostMapping("/keys/validate")
    public ResponseEntity<?> validateKey(@RequestBody Map<String, String> request) {
        KeyValidation validation = encryptionService.validatePublicKey(request.get("publicKey"));
        if (validation.isValid()) {
            return ResponseEntity.ok(validation);
        }
        return ResponseEntity.badRequest().body(validation);
    }

}
