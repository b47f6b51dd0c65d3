package me.golemcore.relay.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One reply item produced by the agent: text, media or both.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReplyPayload(String text, String mediaUrl, List<String> mediaUrls) {

    public static ReplyPayload text(String text) {
        return new ReplyPayload(text, null, null);
    }

    /**
     * All media of this payload; {@code mediaUrls} wins over {@code mediaUrl}.
     */
    public List<String> mediaList() {
        if (mediaUrls != null) {
            return mediaUrls;
        }
        return mediaUrl != null ? List.of(mediaUrl) : List.of();
    }

    public String textOrEmpty() {
        return text != null ? text : "";
    }
}
