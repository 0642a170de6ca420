package com.williamcallahan.baptismdesk.web;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * Body of the batch endpoints. A missing or empty list means "every eligible profile" where the
 * endpoint supports it.
 *
 * @param ids requested profile ids
 */
public record ProfileIdsRequest(List<@NotBlank(message = "must not contain blank ids") String> ids) {
    public ProfileIdsRequest {
        ids = ids == null ? List.of() : List.copyOf(ids);
    }

    static List<String> idsOf(ProfileIdsRequest request) {
        return request == null ? List.of() : request.ids();
    }
}
