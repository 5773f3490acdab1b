package com.rodoc.ocr.controller;

import com.rodoc.ocr.model.ProcessRequest;
import com.rodoc.ocr.model.ProcessingFailure;
import com.rodoc.ocr.model.ProcessingResponse;
import com.rodoc.ocr.model.TemplateSummary;
import com.rodoc.ocr.service.DocumentProcessingService;
import com.rodoc.ocr.service.registry.DocumentTemplate;
import com.rodoc.ocr.service.registry.ExtractionField;
import com.rodoc.ocr.service.registry.TemplateRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.Base64;
import java.util.List;
import java.util.stream.Collectors;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/v1/documents")
@Tag(name = "Documents", description = "Romanian document classification and field extraction")
public class DocumentController {

    private final DocumentProcessingService service;
    private final TemplateRegistry registry;

    public DocumentController(DocumentProcessingService service, TemplateRegistry registry) {
        this.service = service;
        this.registry = registry;
    }

    @Operation(
            summary = "Process an uploaded document image",
            description = "Classifies the page, extracts structured fields and returns a confidence-scored result.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Document processed",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = ProcessingResponse.class))),
            @ApiResponse(responseCode = "400", description = "Missing or undecodable image",
                    content = @Content(schema = @Schema(implementation = ProcessingFailure.class))),
            @ApiResponse(responseCode = "422", description = "Text too poor to process",
                    content = @Content(schema = @Schema(implementation = ProcessingFailure.class))),
            @ApiResponse(responseCode = "503", description = "Recognition engine unavailable or timed out",
                    content = @Content(schema = @Schema(implementation = ProcessingFailure.class)))
    })
    @PostMapping(value = "/process", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ProcessingResponse> processUpload(
            @Parameter(description = "Photographed or scanned document", required = true)
            @RequestPart("file") MultipartFile file,
            @Parameter(description = "Optional document type hint")
            @RequestParam(value = "typeHint", required = false) String typeHint) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "Image file is required");
        }
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Failed to read uploaded image", ex);
        }
        return ResponseEntity.ok(ProcessingResponse.from(service.process(content, typeHint)));
    }

    @Operation(summary = "Process a Base64 encoded document image")
    @PostMapping(value = "/process", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProcessingResponse> processBase64(@Valid @RequestBody ProcessRequest request) {
        byte[] content;
        try {
            content = Base64.getMimeDecoder().decode(request.imageBase64());
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Invalid Base64 image data", ex);
        }
        if (content.length == 0) {
            throw new ResponseStatusException(BAD_REQUEST, "Invalid Base64 image data");
        }
        return ResponseEntity.ok(ProcessingResponse.from(service.process(content, request.typeHint())));
    }

    @Operation(summary = "List the document templates known to the engine")
    @GetMapping("/templates")
    public ResponseEntity<List<TemplateSummary>> templates() {
        List<TemplateSummary> summaries = registry.templates().stream()
                .map(DocumentController::toSummary)
                .collect(Collectors.toList());
        return ResponseEntity.ok(summaries);
    }

    private static TemplateSummary toSummary(DocumentTemplate template) {
        return new TemplateSummary(
                template.id(),
                template.documentType(),
                template.language(),
                template.confidenceThreshold(),
                template.identificationSources(),
                template.fields().stream().map(ExtractionField::name).collect(Collectors.toList()));
    }
}
