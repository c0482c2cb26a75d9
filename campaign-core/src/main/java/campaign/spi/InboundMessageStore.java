package campaign.spi;

import campaign.model.InboundMessage;

import java.sql.Connection;
import java.util.List;

public interface InboundMessageStore {

  void insert(Connection conn, InboundMessage message);

  boolean exists(Connection conn, String tenantId, String id);

  List<InboundMessage> listByContact(Connection conn, String tenantId, String campaignId, String contactId);
}
