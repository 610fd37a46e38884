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

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One request to the NationStates site: either an API call (shards and query
 * parameters against the API endpoint) or a data dump download (a fixed path
 * on the same host).
 *
 * <p>
 * Shard names end up joined into the single {@code q} parameter. A shard may
 * bring its own parameters, which are merged into the query.
 */
public final class ApiRequest {

    private static final DateTimeFormatter ARCHIVE_DATE = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final Set<String> SECRET_PARAMETERS = Set.of("client", "key");

    private final String path;
    private final List<String> shards;
    private final Map<String, String> parameters;

    private ApiRequest(String path, List<String> shards, Map<String, String> parameters) {
        this.path = path;
        this.shards = Collections.unmodifiableList(new ArrayList<>(shards));
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ApiRequest world(String... shards) {
        return builder().shards(shards).build();
    }

    public static ApiRequest nation(String nation, String... shards) {
        return builder().param("nation", nation).shards(shards).build();
    }

    public static ApiRequest region(String region, String... shards) {
        return builder().param("region", region).shards(shards).build();
    }

    /**
     * World Assembly request. Council 1 is the General Assembly, 2 the
     * Security Council.
     */
    public static ApiRequest wa(int council, String... shards) {
        if (council != 1 && council != 2) {
            throw new IllegalArgumentException("council must be 1 or 2, got: " + council);
        }
        return builder().param("wa", Integer.toString(council)).shards(shards).build();
    }

    /**
     * Private command on behalf of {@code nation}. Needs a credentialed
     * limiter.
     */
    public static ApiRequest command(String nation, String command, Map<String, String> parameters) {
        Builder builder = builder().param("nation", nation).param("c", command);
        if (parameters != null) {
            parameters.forEach(builder::param);
        }
        return builder.build();
    }

    public static Shard shard(String name, Map<String, String> parameters) {
        return new Shard(name, parameters);
    }

    /**
     * Current nations dump, or the archived one for {@code date} when given.
     */
    public static ApiRequest nationsDump(LocalDate date) {
        return dump(date == null
                ? "/pages/nations.xml.gz"
                : "/archive/nations/" + ARCHIVE_DATE.format(date) + "-nations-xml.gz");
    }

    /**
     * Current regions dump, or the archived one for {@code date}. Archived
     * region dumps live next to the nation ones.
     */
    public static ApiRequest regionsDump(LocalDate date) {
        return dump(date == null
                ? "/pages/regions.xml.gz"
                : "/archive/nations/" + ARCHIVE_DATE.format(date) + "-regions-xml.gz");
    }

    public static ApiRequest cardsDump(int season) {
        if (season < 1) {
            throw new IllegalArgumentException("season must be >= 1, got: " + season);
        }
        return dump("/pages/cardlist_S" + season + ".xml.gz");
    }

    private static ApiRequest dump(String path) {
        return new ApiRequest(path, List.of(), Map.of());
    }

    /**
     * Whether this request targets the API endpoint and therefore counts
     * against the API quota. Dumps do not.
     */
    public boolean isApiCall() {
        return path == null;
    }

    /**
     * Absolute path of a dump, {@code null} for API calls.
     */
    public String path() {
        return path;
    }

    public List<String> shards() {
        return shards;
    }

    public Map<String, String> parameters() {
        return parameters;
    }

    /**
     * Value of the {@code q} parameter as sent: shard names joined by
     * {@code +}, or {@code null} when there are none.
     */
    public String q() {
        return shards.isEmpty() ? null : String.join("+", shards);
    }

    /**
     * Nation the request acts for, if any. Credentials are only attached when
     * this is set.
     */
    public String nation() {
        return parameters.get("nation");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ApiRequest other)) {
            return false;
        }
        return Objects.equals(path, other.path) && shards.equals(other.shards)
                && parameters.equals(other.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, shards, parameters);
    }

    @Override
    public String toString() {
        if (path != null) {
            return "ApiRequest[dump " + path + "]";
        }
        Map<String, String> shown = new LinkedHashMap<>(parameters);
        SECRET_PARAMETERS.forEach(name -> shown.computeIfPresent(name, (k, v) -> "***"));
        return "ApiRequest[q=" + q() + ", " + shown + "]";
    }

    /**
     * A shard name with parameters of its own, such as {@code census} with
     * {@code scale=all}.
     */
    public record Shard(String name, Map<String, String> parameters) {

        public Shard {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("shard name cannot be blank");
            }
            parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        }
    }

    public static final class Builder {

        private final List<String> shards = new ArrayList<>();
        private final Map<String, String> parameters = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder shard(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("shard name cannot be blank");
            }
            shards.add(name.trim());
            return this;
        }

        public Builder shards(String... names) {
            for (String name : names) {
                shard(name);
            }
            return this;
        }

        public Builder shard(Shard shard) {
            shard(shard.name());
            shard.parameters().forEach(this::param);
            return this;
        }

        public Builder param(String name, String value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("parameter name cannot be blank");
            }
            if ("q".equals(name)) {
                throw new IllegalArgumentException("use shard(...) instead of the q parameter");
            }
            parameters.put(name, Objects.requireNonNull(value, name));
            return this;
        }

        public ApiRequest build() {
            return new ApiRequest(null, shards, parameters);
        }
    }
}
