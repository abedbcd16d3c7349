package com.flagship.hospital_cash.auth;

import com.flagship.hospital_cash.auth.dto.LoginRequest;
import com.flagship.hospital_cash.auth.dto.LoginResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Opens and closes the HTTP session that the API endpoints read the user and project from.
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final AuthService authService;

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request,
                                               HttpServletRequest httpRequest) {
        AuthService.Authentication authentication =
            authService.login(request.getUsername(), request.getPassword(), request.getProject());

        HttpSession session = httpRequest.getSession(true);
        httpRequest.changeSessionId();
        session.setAttribute(SessionAttributes.USER, authentication.user());
        session.setAttribute(SessionAttributes.PROJECT, authentication.project());

        return ResponseEntity.ok(new LoginResponse(authentication.user(), authentication.project()));
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(HttpServletRequest httpRequest) {
        HttpSession session = httpRequest.getSession(false);
        if (session != null) {
            session.invalidate();
            log.debug("Session invalidated");
        }
        return ResponseEntity.ok().build();
    }
}
