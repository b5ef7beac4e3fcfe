package com.docfederation.api;

import com.docfederation.model.docs.UnifiedConfig;
import com.docfederation.service.UnifiedConfigPublisher;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Serves the current unified config snapshot to the site renderer.
 */
@RestController
@RequestMapping("/api/v1/site")
@RequiredArgsConstructor
public class SiteConfigController {

    static final String VERSION_HEADER = "X-Config-Version";

    private final UnifiedConfigPublisher configPublisher;

    @GetMapping("/config")
    public ResponseEntity<String> config(
            @RequestHeader(value = HttpHeaders.IF_NONE_MATCH, required = false) String ifNoneMatch) {
        UnifiedConfig config = configPublisher.current();
        String etag = "\"" + config.contentHash() + "\"";
        if (etag.equals(ifNoneMatch)) {
            return ResponseEntity.status(HttpStatus.NOT_MODIFIED)
                    .eTag(etag)
                    .header(VERSION_HEADER, String.valueOf(config.version()))
                    .build();
        }
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("application/yaml"))
                .eTag(etag)
                .header(VERSION_HEADER, String.valueOf(config.version()))
                .body(config.content());
    }
}
