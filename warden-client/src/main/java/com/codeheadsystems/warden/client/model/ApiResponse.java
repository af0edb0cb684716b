package com.codeheadsystems.warden.client.model;

import java.util.Optional;

/**
 * A decoded success response.
 *
 * @param data    the decoded body, null for {@code Void} responses
 * @param billing credit accounting, when the server sent it
 * @param <T>     the body type
 */
public record ApiResponse<T>(T data, Optional<BillingInfo> billing) {
}
