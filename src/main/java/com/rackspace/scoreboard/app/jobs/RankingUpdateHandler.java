/*
 * Copyright 2022 Rackspace US, Inc.
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
 */

package com.rackspace.scoreboard.app.jobs;

import com.rackspace.scoreboard.app.model.Job;
import com.rackspace.scoreboard.app.model.JobType;
import com.rackspace.scoreboard.app.model.payload.RankingUpdatePayload;
import com.rackspace.scoreboard.app.services.RankingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@Slf4j
public class RankingUpdateHandler extends AbstractJobHandler<RankingUpdatePayload> {

  private final RankingService rankingService;

  @Autowired
  public RankingUpdateHandler(RankingService rankingService) {
    super(JobType.RANKING_UPDATE, RankingUpdatePayload.class);
    this.rankingService = rankingService;
  }

  @Override
  protected Mono<Void> handle(Job job, RankingUpdatePayload payload) {
    return rankingService.refreshRankingsForExam(payload.getExamId())
        .doOnNext(standings -> log.debug("Refreshed rankings of exam={} with {} standings",
            payload.getExamId(), standings.size()))
        .then();
  }
}
