package com.github.germanosin.lifeevents.cdc;

import com.github.germanosin.lifeevents.cdc.exception.ProvisioningException;

/**
 * Makes sure the server-side objects a replication stream needs exist.
 */
@FunctionalInterface
public interface Provisioner {
  void provision() throws ProvisioningException;
}
