package com.insightreel.pipeline.client;

import com.insightreel.pipeline.dto.RenderRequest;
import com.insightreel.pipeline.dto.RenderStatus;

/**
 * External avatar rendering provider.
 */
public interface AvatarRenderProvider {

    /**
     * @return the provider-side job id
     */
    String submitRender(RenderRequest request);

    RenderStatus getStatus(String providerJobId);
}
