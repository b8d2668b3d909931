/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Kitbash Viewer.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.kitbash.viewer.scene;

import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link ContentFetcher} issuing {@code GET /content/{name}} with OkHttp.
 *
 * @author hal.hildebrand
 */
public class OkHttpContentFetcher implements ContentFetcher {
    private static final Logger log = LoggerFactory.getLogger(OkHttpContentFetcher.class);

    private final OkHttpClient client;
    private final HttpUrl      base;

    /**
     * @param client    shared HTTP client
     * @param serverUri portal address, e.g. {@code http://127.0.0.1:8080}
     */
    public OkHttpContentFetcher(OkHttpClient client, URI serverUri) {
        this.client = Objects.requireNonNull(client);
        this.base = HttpUrl.get(serverUri.toString());
    }

    @Override
    public CompletableFuture<byte[]> fetch(String name, long version) {
        var url = base.newBuilder().addPathSegment("content").addPathSegment(name).build();
        var call = client.newCall(new Request.Builder().url(url).get().build());
        var result = new CompletableFuture<byte[]>();
        result.whenComplete((bytes, error) -> {
            if (result.isCancelled()) {
                call.cancel();
            }
        });
        log.debug("Fetching {} v{}", name, version);
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call c, IOException e) {
                result.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call c, Response response) {
                try (response) {
                    if (response.code() == 404) {
                        result.completeExceptionally(new FileNotFoundException(name + " is no longer served"));
                    } else if (!response.isSuccessful()) {
                        result.completeExceptionally(
                        new IOException("Fetching " + name + " failed: HTTP " + response.code()));
                    } else {
                        result.complete(response.body().bytes());
                    }
                } catch (IOException e) {
                    result.completeExceptionally(e);
                }
            }
        });
        return result;
    }
}
