package dev.taskgate.controller;

import dev.taskgate.domain.entity.Installation;
import dev.taskgate.dto.request.CreateInstallationRequest;
import dev.taskgate.dto.response.InstallationResponse;
import dev.taskgate.service.TokenService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;
import java.util.UUID;

/**
 * Tenant provisioning. Admin only (HTTP Basic, see SecurityConfig).
 */
@RestController
@RequestMapping("/installations")
public class InstallationController {
    private final TokenService tokenService;

    public InstallationController(TokenService tokenService) { this.tokenService = tokenService; }

    @PostMapping
    public ResponseEntity<InstallationResponse> create(@RequestBody CreateInstallationRequest request) {
        Installation installation = tokenService.createInstallation(request);
        return ResponseEntity.created(URI.create("/installations/" + installation.getId()))
                .body(InstallationResponse.from(installation));
    }

    @GetMapping("/{id}")
    public ResponseEntity<InstallationResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(InstallationResponse.from(tokenService.getInstallation(id)));
    }

    @GetMapping
    public ResponseEntity<List<InstallationResponse>> list(@RequestParam(required = false) String platform) {
        return ResponseEntity.ok(tokenService.listActiveInstallations(platform).stream()
                .map(InstallationResponse::from)
                .toList());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deactivate(@PathVariable UUID id) {
        tokenService.deactivateInstallation(id);
        return ResponseEntity.noContent().build();
    }
}
