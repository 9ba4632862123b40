package com.thorbis.accessservice.api;

import com.thorbis.accessservice.infrastructure.web.CallerResolver;
import com.thorbis.security.policy.PolicyReloadResult;
import com.thorbis.security.policy.PolicySnapshot;
import com.thorbis.security.policy.PolicyStore;
import com.thorbis.security.principal.ResolvedPrincipal;
import com.thorbis.security.tenant.Industry;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** {@code policy_reload(version) -> {success, diagnostics}} for the policy administration tool. */
@RestController
@RequestMapping("/api/v1/policies")
public class PolicyController {

    private final CallerResolver callers;
    private final PolicyStore policyStore;

    public PolicyController(CallerResolver callers, PolicyStore policyStore) {
        this.callers = callers;
        this.policyStore = policyStore;
    }

    /** 200 when the version was activated, 422 with diagnostics when it was rejected. */
    @PostMapping("/reload")
    public ResponseEntity<PolicyReloadResult> reload(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorizationHeader,
            @Valid @RequestBody PolicyReloadRequest body) {
        ResolvedPrincipal operator = callers.resolveOperator(authorizationHeader);
        PolicyReloadResult result = policyStore.reload(body.version(), operator.principal().principalId());
        return ResponseEntity.status(result.success() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY)
                .body(result);
    }

    @GetMapping("/current")
    public Map<String, Object> current(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorizationHeader) {
        callers.resolve(authorizationHeader);
        PolicySnapshot snapshot = policyStore.current();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("version", snapshot.version());
        body.put("loadedAt", snapshot.loadedAt());
        body.put("industries", snapshot.policies().keySet().stream().map(Industry::value).sorted().toList());
        return body;
    }
}
