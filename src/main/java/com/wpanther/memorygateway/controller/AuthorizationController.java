package com.wpanther.memorygateway.controller;

import com.wpanther.memorygateway.entity.OAuth2Client;
import com.wpanther.memorygateway.exception.OAuth2Exception;
import com.wpanther.memorygateway.service.AuthorizationCodeService;
import com.wpanther.memorygateway.service.PkceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Authorization endpoint with a stateless consent page: every pending parameter
 * round-trips through hidden form fields.
 */
@RestController
@RequestMapping("/oauth")
@RequiredArgsConstructor
@Slf4j
public class AuthorizationController {

    public static final String DECISION_APPROVE = "approve";
    public static final String DECISION_DENY = "deny";

    private final AuthorizationCodeService authorizationCodeService;

    @GetMapping("/authorize")
    public ResponseEntity<String> authorize(
            @RequestParam(value = "response_type", required = false) String responseType,
            @RequestParam(value = "client_id", required = false) String clientId,
            @RequestParam(value = "redirect_uri", required = false) String redirectUri,
            @RequestParam(value = "state", required = false) String state,
            @RequestParam(value = "scope", required = false) String scope,
            @RequestParam(value = "code_challenge", required = false) String codeChallenge,
            @RequestParam(value = "code_challenge_method", required = false) String codeChallengeMethod) {

        log.debug("Authorization request from client {}", clientId);
        String method = defaultMethod(codeChallengeMethod);
        OAuth2Client client = validate(responseType, clientId, redirectUri, codeChallenge, method);

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("response_type", responseType);
        fields.put("client_id", clientId);
        fields.put("redirect_uri", redirectUri);
        fields.put("state", state);
        fields.put("scope", scope);
        fields.put("code_challenge", codeChallenge);
        fields.put("code_challenge_method", method);

        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_HTML, StandardCharsets.UTF_8))
                .cacheControl(CacheControl.noStore())
                .body(renderConsentPage(client, scope, fields));
    }

    @PostMapping(value = "/authorize", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<Void> decide(
            @RequestParam(value = "response_type", required = false) String responseType,
            @RequestParam(value = "client_id", required = false) String clientId,
            @RequestParam(value = "redirect_uri", required = false) String redirectUri,
            @RequestParam(value = "state", required = false) String state,
            @RequestParam(value = "scope", required = false) String scope,
            @RequestParam(value = "code_challenge", required = false) String codeChallenge,
            @RequestParam(value = "code_challenge_method", required = false) String codeChallengeMethod,
            @RequestParam(value = "decision", required = false) String decision) {

        String method = defaultMethod(codeChallengeMethod);
        validate(responseType, clientId, redirectUri, codeChallenge, method);

        String location;
        if (DECISION_APPROVE.equals(decision)) {
            String code = authorizationCodeService.issue(clientId, redirectUri, codeChallenge, method, scope);
            location = appendQuery(redirectUri, "code", code, state);
        } else {
            log.info("Authorization denied for client {}", clientId);
            location = appendQuery(redirectUri, "error", OAuth2Exception.ACCESS_DENIED, state);
        }

        return ResponseEntity.status(HttpStatus.FOUND)
                .header(HttpHeaders.LOCATION, location)
                .cacheControl(CacheControl.noStore())
                .build();
    }

    private OAuth2Client validate(String responseType, String clientId, String redirectUri,
                                  String codeChallenge, String method) {
        if (responseType == null || responseType.isEmpty()) {
            throw new OAuth2Exception(OAuth2Exception.INVALID_REQUEST, "response_type is required");
        }
        if (!"code".equals(responseType)) {
            throw new OAuth2Exception(OAuth2Exception.UNSUPPORTED_RESPONSE_TYPE,
                    "Only the code response type is supported");
        }
        return authorizationCodeService.validateAuthorizationRequest(clientId, redirectUri, codeChallenge, method);
    }

    private static String defaultMethod(String codeChallengeMethod) {
        return codeChallengeMethod == null || codeChallengeMethod.isEmpty()
                ? PkceService.METHOD_S256
                : codeChallengeMethod;
    }

    static String appendQuery(String redirectUri, String name, String value, String state) {
        StringBuilder location = new StringBuilder(redirectUri)
                .append(redirectUri.contains("?") ? '&' : '?')
                .append(name).append('=').append(URLEncoder.encode(value, StandardCharsets.UTF_8));
        if (state != null) {
            location.append("&state=").append(URLEncoder.encode(state, StandardCharsets.UTF_8));
        }
        return location.toString();
    }

    private static String renderConsentPage(OAuth2Client client, String scope, Map<String, String> fields) {
        StringBuilder hidden = new StringBuilder();
        fields.forEach((name, value) -> {
            if (value != null) {
                hidden.append("      <input type=\"hidden\" name=\"").append(name)
                        .append("\" value=\"").append(HtmlUtils.htmlEscape(value)).append("\">\n");
            }
        });

        String scopeLine = scope != null && !scope.isBlank()
                ? "    <p>Requested scope: <code>" + HtmlUtils.htmlEscape(scope) + "</code></p>\n"
                : "";

        return "<!DOCTYPE html>\n"
                + "<html lang=\"en\">\n"
                + "<head>\n"
                + "  <meta charset=\"utf-8\">\n"
                + "  <title>Authorize " + HtmlUtils.htmlEscape(client.getName()) + "</title>\n"
                + "</head>\n"
                + "<body>\n"
                + "  <main>\n"
                + "    <h1>Authorize access</h1>\n"
                + "    <p><strong>" + HtmlUtils.htmlEscape(client.getName()) + "</strong> is requesting access"
                + " to the memory gateway.</p>\n"
                + scopeLine
                + "    <form method=\"post\" action=\"authorize\">\n"
                + hidden
                + "      <button type=\"submit\" name=\"decision\" value=\"" + DECISION_APPROVE + "\">Approve</button>\n"
                + "      <button type=\"submit\" name=\"decision\" value=\"" + DECISION_DENY + "\">Deny</button>\n"
                + "    </form>\n"
                + "  </main>\n"
                + "</body>\n"
                + "</html>\n";
    }
}
