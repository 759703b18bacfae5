package com.lifelink.backend.modules.request.application;

import java.util.UUID;

public record RequestPublishedEvent(UUID requestId) {
}
