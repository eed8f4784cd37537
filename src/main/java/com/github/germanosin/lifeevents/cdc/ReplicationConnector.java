package com.github.germanosin.lifeevents.cdc;

import java.sql.SQLException;
import java.util.Properties;

public interface ReplicationConnector {
  ReplicationSession open(String slotName, Properties slotOptions) throws SQLException;
}
