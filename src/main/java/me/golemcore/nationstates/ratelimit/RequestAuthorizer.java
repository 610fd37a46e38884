package me.golemcore.nationstates.ratelimit;

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

import me.golemcore.nationstates.domain.model.ObservedResponse;

import java.util.Map;

/**
 * The two hooks a transport needs around each request: fields to attach
 * before sending and a place to report the response afterwards.
 */
public interface RequestAuthorizer {

    /**
     * Header fields to merge into the outgoing request. Empty when there is
     * nothing to authenticate.
     */
    Map<String, String> prepareRequest();

    /**
     * Feed the response back so quota and session state can be updated.
     */
    ResponseOutcome observe(ObservedResponse response);
}
