package me.golemcore.reposcout.objective;

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

import me.golemcore.reposcout.domain.model.Objective;

import java.util.List;

/**
 * Turns a free-text intent into inferred objectives.
 *
 * <p>
 * Implementations must only return objectives registered in the
 * {@link ObjectiveRegistry}, with weights in [0,1] and source
 * {@link me.golemcore.reposcout.domain.model.ObjectiveSource#INFERRED}. They
 * must be pure functions of the intent.
 *
 * @since 1.0
 * @see KeywordIntentClassifier
 */
public interface IntentClassifier {

    List<Objective> classify(String intent);
}
