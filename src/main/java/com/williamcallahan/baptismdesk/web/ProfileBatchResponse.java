package com.williamcallahan.baptismdesk.web;

import java.util.List;

/**
 * Ids a batch request actually acted on.
 *
 * @param accepted ids queued or transitioned
 */
public record ProfileBatchResponse(List<String> accepted) {}
