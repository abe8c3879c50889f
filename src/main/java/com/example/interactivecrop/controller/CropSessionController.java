package com.example.interactivecrop.controller;

import com.example.interactivecrop.geometry.DrawBox;
import com.example.interactivecrop.model.AspectLockRequest;
import com.example.interactivecrop.model.CropRequest;
import com.example.interactivecrop.model.DecisionRequest;
import com.example.interactivecrop.model.DecisionResponse;
import com.example.interactivecrop.model.ErrorResponse;
import com.example.interactivecrop.model.LayoutRequest;
import com.example.interactivecrop.model.PointerEventRequest;
import com.example.interactivecrop.model.PointerResponse;
import com.example.interactivecrop.model.ReleaseRequest;
import com.example.interactivecrop.model.ReleaseResponse;
import com.example.interactivecrop.model.RenderFrame;
import com.example.interactivecrop.model.SelectionRequest;
import com.example.interactivecrop.service.CropInteractionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.INTERNAL_SERVER_ERROR;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/v1/crop-sessions")
@Validated
@Tag(name = "Crop sessions", description = "Interactive selection editing and crop decisions")
public class CropSessionController {

    private final CropInteractionService service;

    public CropSessionController(CropInteractionService service) {
        this.service = service;
    }

    @Operation(
            summary = "Open a crop session for a paused run",
            description = "Replaces any session the target already has. Incomplete requests are ignored with 204.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session opened",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = RenderFrame.class))),
            @ApiResponse(responseCode = "204", description = "Request ignored", content = @Content)
    })
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RenderFrame> open(@RequestBody CropRequest request) {
        return service.open(request)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @Operation(summary = "Lay out the preview inside the host element")
    @PostMapping(value = "/{targetId}/layout", consumes = MediaType.APPLICATION_JSON_VALUE)
    public RenderFrame layout(@PathVariable String targetId, @Valid @RequestBody LayoutRequest request) {
        return service.layout(targetId, request);
    }

    @Operation(summary = "Use a draw box computed by the host")
    @PutMapping(value = "/{targetId}/draw-box", consumes = MediaType.APPLICATION_JSON_VALUE)
    public RenderFrame drawBox(@PathVariable String targetId, @RequestBody DrawBox drawBox) {
        return service.drawBox(targetId, drawBox);
    }

    @Operation(
            summary = "Forward a pointer event",
            description = "claimed=false means the overlay ignored the event and the host should handle it.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event processed"),
            @ApiResponse(responseCode = "404", description = "Unknown target",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(value = "/{targetId}/pointer", consumes = MediaType.APPLICATION_JSON_VALUE)
    public PointerResponse pointer(@PathVariable String targetId, @Valid @RequestBody PointerEventRequest event) {
        return service.pointer(targetId, event);
    }

    @Operation(
            summary = "Release any live drag",
            description = "Forwarded for window-level pointerup, mouseup, pointercancel and blur events.")
    @PostMapping("/pointer/release")
    public ReleaseResponse release(@RequestBody(required = false) ReleaseRequest request) {
        return service.forceRelease(request == null ? null : request.reason());
    }

    @Operation(summary = "Report whether the target is selected in the host")
    @PutMapping(value = "/{targetId}/selection", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Void> selection(@PathVariable String targetId, @Valid @RequestBody SelectionRequest request) {
        service.select(targetId, request.selected());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Toggle the aspect-ratio lock")
    @PutMapping(value = "/{targetId}/aspect-lock", consumes = MediaType.APPLICATION_JSON_VALUE)
    public RenderFrame aspectLock(@PathVariable String targetId, @Valid @RequestBody AspectLockRequest request) {
        return service.aspectLock(targetId, request.forceOriginalRatio());
    }

    @Operation(summary = "Current overlay state")
    @GetMapping("/{targetId}/frame")
    public RenderFrame frame(@PathVariable String targetId) {
        return service.frame(targetId);
    }

    @Operation(summary = "Current preview image as PNG")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Preview image",
                    content = @Content(mediaType = MediaType.IMAGE_PNG_VALUE)),
            @ApiResponse(responseCode = "404", description = "Unknown target or preview not loaded yet",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping(value = "/{targetId}/image", produces = MediaType.IMAGE_PNG_VALUE)
    public ResponseEntity<byte[]> image(@PathVariable String targetId) {
        BufferedImage preview = service.previewImage(targetId)
                .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Preview for target " + targetId + " is not loaded"));
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try {
            ImageIO.write(preview, "png", outputStream);
        } catch (IOException ex) {
            throw new ResponseStatusException(INTERNAL_SERVER_ERROR, "Failed to encode preview", ex);
        }
        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_PNG)
                .body(outputStream.toByteArray());
    }

    @Operation(
            summary = "Submit the decision",
            description = "A continue without a selection of at least 2x2 pixels is sent as passthrough. "
                    + "Only the first decision of a session is sent.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Decision processed"),
            @ApiResponse(responseCode = "502", description = "The paused run could not be reached",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(value = "/{targetId}/decisions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public DecisionResponse decide(@PathVariable String targetId, @Valid @RequestBody DecisionRequest request) {
        return service.decide(targetId, request.action());
    }

    @Operation(summary = "Close the session")
    @DeleteMapping("/{targetId}")
    public ResponseEntity<Void> close(
            @Parameter(description = "Element owning the crop", required = true) @PathVariable String targetId) {
        return service.close(targetId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
