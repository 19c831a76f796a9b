/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.soklet.userprofile.model.api.response;

import org.jspecify.annotations.NonNull;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * One page of user profiles.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record UserProfileListResponse(
		@NonNull List<@NonNull UserProfileResponse> items,
		@NonNull Long total,
		@NonNull Integer page,
		@NonNull Integer size
) {
	public UserProfileListResponse {
		requireNonNull(items);
		requireNonNull(total);
		requireNonNull(page);
		requireNonNull(size);

		items = List.copyOf(items);
	}
}
