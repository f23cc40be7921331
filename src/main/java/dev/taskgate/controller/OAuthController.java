package dev.taskgate.controller;

import dev.taskgate.exception.OAuthFlowException;
import dev.taskgate.service.GitHubInstallService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.Map;

/**
 * GitHub install flow. Public: the user arrives here from a browser, and the callback
 * is authenticated by the signed state.
 */
@RestController
@RequestMapping("/oauth")
public class OAuthController {
    private static final Logger log = LoggerFactory.getLogger(OAuthController.class);

    private final GitHubInstallService installService;

    public OAuthController(GitHubInstallService installService) { this.installService = installService; }

    @GetMapping("/github/authorize")
    public ResponseEntity<Map<String, String>> authorize(@RequestParam("redirect_uri") String redirectUri) {
        GitHubInstallService.AuthorizationRequest request = installService.authorize(redirectUri);
        return ResponseEntity.ok(Map.of(
                "authorization_url", request.authorizationUrl(),
                "state", request.state()));
    }

    @GetMapping("/github/callback")
    public ResponseEntity<Void> callback(@RequestParam(required = false) String code,
                                         @RequestParam(required = false) String state,
                                         @RequestParam(name = "installation_id", required = false) String installationId,
                                         @RequestParam(required = false) String error,
                                         @RequestParam(name = "error_description", required = false) String errorDescription) {
        if (error != null) {
            log.warn("GitHub authorization denied: {} ({})", error, errorDescription);
            throw new OAuthFlowException(error + ": " + errorDescription);
        }
        GitHubInstallService.InstallResult result = installService.complete(code, state, installationId);
        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(result.redirectUri())).build();
    }
}
