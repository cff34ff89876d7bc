package com.chatsentinel.botcore.pipeline;

import com.chatsentinel.botcore.config.DataCollectionProperties;
import com.chatsentinel.botcore.model.NormalizedMessage;
import com.chatsentinel.botcore.store.MessageStore;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Extracts phone numbers, links and media urls from messages when enabled. */
@Component
public class DataCollector {

  static final Pattern PHONE =
      Pattern.compile("(\\+?\\d{1,3}[-.\\s]?)?\\(?(\\d{3})\\)?[-.\\s]?(\\d{3})[-.\\s]?(\\d{4})");
  static final Pattern URL = Pattern.compile("https?://\\S+");

  private final DataCollectionProperties properties;
  private final MessageStore store;

  public DataCollector(DataCollectionProperties properties, MessageStore store) {
    this.properties = properties;
    this.store = store;
  }

  /**
   * @return number of data points stored
   */
  public int collect(NormalizedMessage message) {
    if (!properties.anyEnabled()) {
      return 0;
    }
    int saved = 0;
    if (properties.collectPhoneNumbers()) {
      saved += saveAll("phone", PHONE.matcher(message.text()), message);
    }
    if (properties.collectUrls()) {
      saved += saveAll("url", URL.matcher(message.text()), message);
    }
    if (properties.collectMedia()
        && message.mediaRef() != null
        && message.mediaRef().url() != null) {
      store.saveCollectedDataPoint(
          "media", message.mediaRef().url(), message.senderId(), message.id());
      saved++;
    }
    return saved;
  }

  private int saveAll(String kind, Matcher m, NormalizedMessage message) {
    int n = 0;
    while (m.find()) {
      store.saveCollectedDataPoint(kind, m.group(), message.senderId(), message.id());
      n++;
    }
    return n;
  }
}
