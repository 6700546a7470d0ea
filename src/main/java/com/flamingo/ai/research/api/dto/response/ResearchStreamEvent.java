package com.flamingo.ai.research.api.dto.response;

import com.flamingo.ai.research.domain.enums.ResearchStatus;
import com.flamingo.ai.research.domain.model.StateUpdate;
import com.flamingo.ai.research.service.research.ResearchReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for streamed research progress. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchStreamEvent {

  /** Event type: update, done, error. */
  private String eventType;

  /** Event data (JSON object). */
  private Object data;

  /** Creates an update event for one executed workflow node. */
  public static ResearchStreamEvent update(
      String nodeName, StateUpdate update, ResearchStatus status) {
    return ResearchStreamEvent.builder()
        .eventType("update")
        .data(new UpdateData(nodeName, status, update))
        .build();
  }

  /** Creates the final event of a successful run. */
  public static ResearchStreamEvent done(ResearchReport report) {
    return ResearchStreamEvent.builder().eventType("done").data(report).build();
  }

  /** Creates the final event of a failed run. */
  public static ResearchStreamEvent error(String errorId, String message, ResearchReport report) {
    return ResearchStreamEvent.builder()
        .eventType("error")
        .data(new ErrorData(errorId, message, report))
        .build();
  }

  /** Update event data. */
  @Data
  @AllArgsConstructor
  public static class UpdateData {
    private String nodeName;
    private ResearchStatus status;
    private StateUpdate update;
  }

  /** Error event data. */
  @Data
  @AllArgsConstructor
  public static class ErrorData {
    private String errorId;
    private String message;
    private ResearchReport report;
  }
}
