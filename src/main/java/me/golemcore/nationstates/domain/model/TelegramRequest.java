package me.golemcore.nationstates.domain.model;

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

/**
 * A telegram send through the API client key.
 *
 * @param client
 *            API client key
 * @param tgid
 *            id of the template telegram
 * @param key
 *            secret key of the template telegram
 * @param to
 *            recipient nation
 * @param recruitment
 *            whether this is a recruitment telegram, which is paced more
 *            slowly
 */
public record TelegramRequest(String client, String tgid, String key, String to, boolean recruitment) {

    public TelegramRequest {
        requireText(client, "client");
        requireText(tgid, "tgid");
        requireText(key, "key");
        requireText(to, "to");
    }

    public ApiRequest toApiRequest() {
        return ApiRequest.builder()
                .param("a", "sendtg")
                .param("client", client)
                .param("tgid", tgid)
                .param("key", key)
                .param("to", to)
                .build();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be blank");
        }
    }
}
