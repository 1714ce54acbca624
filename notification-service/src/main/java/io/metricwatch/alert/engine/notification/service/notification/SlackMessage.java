package io.metricwatch.alert.engine.notification.service.notification;

import com.google.common.base.Strings;
import io.metricwatch.alert.engine.notification.transport.webhook.slack.SectionBlock;
import io.metricwatch.alert.engine.notification.transport.webhook.slack.Text;
import java.time.Instant;
import java.util.List;

public interface SlackMessage {

  static SectionBlock getTitleBlock(String titleMessage) {
    SectionBlock titleBlock = new SectionBlock();
    titleBlock.setText(Text.markdown(titleMessage));
    return titleBlock;
  }

  static void addIfNotEmpty(List<Text> metadataFields, String value, String type) {
    if (!Strings.isNullOrEmpty(value)) {
      metadataFields.add(Text.markdown("*" + type + ":*\n" + value));
    }
  }

  /** Slack renders {@code <!date^...>} in the reader's time zone, falling back to the UTC text. */
  static void addTimestamp(List<Text> metadataFields, Instant value, String type) {
    if (value != null && !Strings.isNullOrEmpty(type)) {
      metadataFields.add(
          Text.markdown(
              "*"
                  + type
                  + ":*\n"
                  + "<!date^"
                  + value.getEpochSecond()
                  + "^{date_num} {time_secs}|"
                  + value
                  + " UTC>"));
    }
  }
}
