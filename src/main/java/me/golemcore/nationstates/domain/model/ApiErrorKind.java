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
 * Error statuses the NationStates API is known to return, narrowed from the
 * raw HTTP code.
 */
public enum ApiErrorKind {

    BAD_REQUEST,
    FORBIDDEN,
    NOT_FOUND,
    CONFLICT,
    TEAPOT,
    TOO_MANY_REQUESTS,
    CLIENT_ERROR,
    SERVER_ERROR,
    UNEXPECTED;

    public static ApiErrorKind fromStatus(int status) {
        return switch (status) {
        case 400 -> BAD_REQUEST;
        case 403 -> FORBIDDEN;
        case 404 -> NOT_FOUND;
        case 409 -> CONFLICT;
        case 418 -> TEAPOT;
        case 429 -> TOO_MANY_REQUESTS;
        default -> {
            if (status >= 400 && status < 500) {
                yield CLIENT_ERROR;
            }
            yield status >= 500 && status < 600 ? SERVER_ERROR : UNEXPECTED;
        }
        };
    }
}
