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

package com.rackspace.scoreboard.app.scoring;

import com.rackspace.scoreboard.app.entities.Exam;
import com.rackspace.scoreboard.app.entities.ExamAttempt;
import com.rackspace.scoreboard.app.entities.ExamQuestion;
import com.rackspace.scoreboard.app.exceptions.SubmissionRejectedException;
import com.rackspace.scoreboard.app.model.ExamResult;
import com.rackspace.scoreboard.app.model.Submission;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Scores an exam attempt against the exam's answer key.
 */
@Component
public class ResultCalculator {

  /**
   * Rejects a submission that cannot be scored.
   *
   * @throws SubmissionRejectedException describing the first problem found
   */
  public void validate(Submission submission, Collection<ExamQuestion> questions) {
    if (StringUtils.isBlank(submission.getParticipantId())) {
      throw new SubmissionRejectedException("participantId is required");
    }
    if (submission.getStartTime() != null && submission.getEndTime() != null
        && submission.getEndTime().isBefore(submission.getStartTime())) {
      throw new SubmissionRejectedException("endTime is before startTime");
    }
    if (submission.getAnswers() != null) {
      final Map<String, ExamQuestion> byId = index(questions);
      for (String questionId : submission.getAnswers().keySet()) {
        if (!byId.containsKey(questionId)) {
          throw new SubmissionRejectedException("Unknown question " + questionId);
        }
      }
    }
  }

  public ExamAttempt toAttempt(String examId, Submission submission, Instant submittedAt) {
    return new ExamAttempt()
        .setExamId(examId)
        .setParticipantId(submission.getParticipantId())
        .setSelectedOptions(submission.getAnswers())
        .setMarksAwarded(submission.getMarksAwarded())
        .setStartTime(submission.getStartTime())
        .setEndTime(submission.getEndTime())
        .setSubmittedAt(submittedAt);
  }

  public ExamResult calculate(Exam exam, Collection<ExamQuestion> questions, ExamAttempt attempt,
                              Instant now) {
    final double totalMarks = totalMarks(exam, questions);
    final double score = Math.min(totalMarks, Math.max(0, rawScore(questions, attempt)));
    final double percentage = totalMarks > 0 ? score * 100 / totalMarks : 0;

    return new ExamResult()
        .setExamId(exam.getExamId())
        .setParticipantId(attempt.getParticipantId())
        .setSubjectId(exam.getSubjectId())
        .setClassId(exam.getClassId())
        .setScore(score)
        .setTotalMarks(totalMarks)
        .setPercentage(percentage)
        .setGrade(Grades.forResult(percentage))
        .setStartTime(attempt.getStartTime())
        .setEndTime(attempt.getEndTime())
        .setCompleted(attempt.getEndTime() != null)
        .setUpdatedAt(now);
  }

  static double totalMarks(Exam exam, Collection<ExamQuestion> questions) {
    if (exam.getTotalMarks() != null && exam.getTotalMarks() > 0) {
      return exam.getTotalMarks();
    }
    return questions.stream().mapToDouble(ExamQuestion::getMarks).sum();
  }

  private static double rawScore(Collection<ExamQuestion> questions, ExamAttempt attempt) {
    final Map<String, String> selected =
        attempt.getSelectedOptions() != null ? attempt.getSelectedOptions() : Map.of();
    final Map<String, Double> awarded =
        attempt.getMarksAwarded() != null ? attempt.getMarksAwarded() : Map.of();

    double score = 0;
    for (ExamQuestion question : questions) {
      final Double marksAwarded = awarded.get(question.getQuestionId());
      if (marksAwarded != null && marksAwarded > 0) {
        score += marksAwarded;
      } else if (question.getCorrectOptionId() != null
          && Objects.equals(question.getCorrectOptionId(), selected.get(question.getQuestionId()))) {
        score += question.getMarks();
      }
    }
    return score;
  }

  private static Map<String, ExamQuestion> index(Collection<ExamQuestion> questions) {
    return questions.stream()
        .collect(Collectors.toMap(ExamQuestion::getQuestionId, Function.identity(), (a, b) -> a));
  }
}
