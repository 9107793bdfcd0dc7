package com.synthetic.cycleengine.api;

import com.synthetic.cycleengine.api.dto.AdminTargetRequest;
import com.synthetic.cycleengine.domain.exception.ErrorCode;
import com.synthetic.cycleengine.domain.exception.ProtocolException;
import com.synthetic.cycleengine.domain.external.Role;
import com.synthetic.cycleengine.infra.security.ConfiguredCapabilityService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Admin-managed LP allow-list.
 */
@Slf4j
@RestController
@RequestMapping("/api/access/liquidity-providers")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class AccessController {

    private final ConfiguredCapabilityService capabilityService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> grant(@RequestBody AdminTargetRequest body) {
        requireAdmin(body.admin());
        capabilityService.grant(body.account(), Role.LIQUIDITY_PROVIDER);
        log.info("[Access API] {} allow-listed as LP by {}", body.account(), body.admin());
        return ResponseEntity.ok(Map.of("success", true, "account", body.account()));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> revoke(@RequestBody AdminTargetRequest body) {
        requireAdmin(body.admin());
        capabilityService.revoke(body.account(), Role.LIQUIDITY_PROVIDER);
        log.info("[Access API] {} removed from LP allow-list by {}", body.account(), body.admin());
        return ResponseEntity.ok(Map.of("success", true, "account", body.account()));
    }

    @GetMapping("/{account}")
    public ResponseEntity<Map<String, Object>> check(@PathVariable String account) {
        return ResponseEntity.ok(Map.of(
                "account", account,
                "liquidityProvider", capabilityService.hasRole(account, Role.LIQUIDITY_PROVIDER),
                "admin", capabilityService.hasRole(account, Role.ADMIN)));
    }

    private void requireAdmin(String admin) {
        if (!capabilityService.hasRole(admin, Role.ADMIN)) {
            throw ProtocolException.of(ErrorCode.NOT_AUTHORIZED, "%s is not %s", admin, Role.ADMIN);
        }
    }
}
