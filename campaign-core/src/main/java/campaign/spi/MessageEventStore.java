package campaign.spi;

import campaign.model.MessageEvent;

import java.sql.Connection;
import java.util.List;

public interface MessageEventStore {

  void insert(Connection conn, MessageEvent event);

  boolean existsByProviderEventId(Connection conn, String tenantId, String providerEventId);

  List<MessageEvent> listByMessage(Connection conn, String tenantId, String messageId);
}
