package com.mergington.activities.controller;

import com.mergington.activities.model.Document;
import com.mergington.activities.service.DocumentService;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

@RestController
@Validated
@RequestMapping("/activities/{activityName}")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentService documentService;

    /**
     * Upload a certificate or score proof. Only the file name and content type are kept.
     * Email and score are read from the multipart body only, never from the query string.
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> uploadDocument(
            @PathVariable String activityName,
            @RequestPart("email") String email,
            @RequestPart("file") MultipartFile file,
            @RequestPart("score") @Pattern(regexp = "[-+]?\\d{1,9}") String score) {
        String message = documentService.submit(
                activityName,
                email,
                file.getOriginalFilename(),
                file.getContentType(),
                Integer.parseInt(score));
        return ResponseEntity.ok(Map.of("message", message));
    }

    @GetMapping("/documents")
    public ResponseEntity<List<Document>> getDocuments(@PathVariable String activityName) {
        return ResponseEntity.ok(documentService.listDocuments(activityName));
    }

    /**
     * Admin verification of an uploaded document.
     */
    @PostMapping("/verify")
    public ResponseEntity<?> verifyDocument(
            @PathVariable String activityName,
            @RequestParam String email,
            @RequestParam String filename) {
        return ResponseEntity.ok(Map.of("message", documentService.verify(activityName, email, filename)));
    }
}
