package com.collabnote.backend.global.security;

import java.util.List;

public record JwtAuthenticationPrincipal(Long userId, String loginId, List<String> roles) {
}
