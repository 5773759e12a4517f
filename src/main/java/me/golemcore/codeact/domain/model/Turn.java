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


package me.golemcore.codeact.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One exchange: the user prompt, every model response of the exchange, and the
 * tool results fed back in between.
 *
 * <p>
 * The session log receives a turn as it happens: one record per finished round
 * with status {@link TurnStatus#IN_PROGRESS}, then a closing record with the
 * final status. Records of one turn share its {@code id} and are merged back on
 * load.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Turn {

    private String id;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private TurnStatus status;
}
