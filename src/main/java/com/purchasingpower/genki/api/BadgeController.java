package com.purchasingpower.genki.api;

import com.purchasingpower.genki.exception.BotAccountRejectedException;
import com.purchasingpower.genki.exception.MissingConfigurationException;
import com.purchasingpower.genki.model.ActivitySnapshot;
import com.purchasingpower.genki.model.BadgeStyle;
import com.purchasingpower.genki.model.SnapshotLookup;
import com.purchasingpower.genki.service.BadgeCacheService;
import com.purchasingpower.genki.service.BadgeRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

/**
 * Serves the activity badge.
 *
 * GET /badge?style=flat|flat-square|plastic|for-the-badge|social
 *
 * The commit count, tier and username are also exposed as response headers.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class BadgeController {

    static final MediaType SVG = new MediaType("image", "svg+xml", StandardCharsets.UTF_8);

    private final BadgeCacheService badgeCacheService;
    private final BadgeRenderer badgeRenderer;

    @GetMapping("/badge")
    public ResponseEntity<String> badge(@RequestParam(required = false) String style) {
        try {
            SnapshotLookup lookup = badgeCacheService.getSnapshot();
            ActivitySnapshot snapshot = lookup.snapshot();

            String svg = badgeRenderer.render(snapshot.status(), snapshot.commits(), BadgeStyle.fromParam(style));

            return ResponseEntity.ok()
                    .contentType(SVG)
                    .header(HttpHeaders.CACHE_CONTROL, "public, max-age=3600")
                    .header("X-Commits", String.valueOf(snapshot.commits()))
                    .header("X-Status", snapshot.status().getValue())
                    .header("X-Username", lookup.username())
                    .body(svg);

        } catch (MissingConfigurationException e) {
            return ResponseEntity.internalServerError()
                    .contentType(MediaType.TEXT_PLAIN)
                    .body(e.getMessage());
        } catch (BotAccountRejectedException e) {
            log.warn("Rejected bot account: {}", e.getUsername());
            return ResponseEntity.badRequest()
                    .contentType(MediaType.TEXT_PLAIN)
                    .body("Bot users are not supported");
        } catch (Exception e) {
            log.error("Error generating badge", e);
            return ResponseEntity.internalServerError()
                    .contentType(MediaType.TEXT_PLAIN)
                    .body("Error generating badge");
        }
    }
}
