package me.golemcore.reposcout.port.outbound;

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

import me.golemcore.reposcout.domain.model.CandidateProfile;
import me.golemcore.reposcout.domain.model.Objective;

import java.util.List;

/**
 * Supplies the candidate repositories to score for a set of objectives.
 */
public interface CandidateSourcePort {

    List<CandidateProfile> fetchCandidates(List<Objective> objectives);
}
