package com.github.germanosin.lifeevents.cdc;

import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import org.junit.Assert;
import org.junit.Test;

public class CdcSettingsTest {

  @Test
  public void appliesDefaults() {
    Properties properties = new Properties();
    properties.setProperty("cdc.jdbc-url", "jdbc:postgresql://db:5432/app");

    CdcSettings settings = CdcSettings.fromProperties(properties);

    Assert.assertEquals(CdcSettings.DEFAULT_PUBLICATION, settings.getPublicationName());
    Assert.assertEquals(CdcSettings.DEFAULT_SLOT, settings.getSlotName());
    Assert.assertEquals(CdcSettings.DEFAULT_TABLE, settings.getTableName());
    Assert.assertEquals("pgoutput", settings.getPlugin());
    Assert.assertEquals(Duration.ofSeconds(5), settings.getRecoveryBackoff());
    Assert.assertEquals(Duration.ofMillis(10), settings.getPollInterval());
    Assert.assertNull(settings.getUser());
  }

  @Test
  public void readsClasspathResource() {
    CdcSettings settings = CdcSettings.fromProperties(
        CdcSettings.withOverrides(load(), Map.of()));

    Assert.assertEquals("jdbc:postgresql://localhost:5432/postgres", settings.getJdbcUrl());
    Assert.assertEquals("postgres", settings.getUser());
    Assert.assertEquals("life_events_slot", settings.getSlotName());
  }

  @Test
  public void environmentOverridesProperties() {
    Properties merged = CdcSettings.withOverrides(load(), Map.of(
        "CDC_SLOT", "other_slot",
        "CDC_RECOVERY_BACKOFF_MS", "250",
        "CDC_TABLE", " "
    ));

    CdcSettings settings = CdcSettings.fromProperties(merged);

    Assert.assertEquals("other_slot", settings.getSlotName());
    Assert.assertEquals(Duration.ofMillis(250), settings.getRecoveryBackoff());
    Assert.assertEquals("life_events", settings.getTableName());
  }

  @Test
  public void slotOptionsNamePublication() {
    CdcSettings settings = CdcSettings.builder()
        .jdbcUrl("jdbc:postgresql://db/app")
        .publicationName("pub")
        .build();

    Properties options = settings.slotOptions();

    Assert.assertEquals("1", options.getProperty("proto_version"));
    Assert.assertEquals("pub", options.getProperty("publication_names"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsMissingUrl() {
    CdcSettings.fromProperties(new Properties());
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsInvalidBackoff() {
    Properties properties = new Properties();
    properties.setProperty("cdc.jdbc-url", "jdbc:postgresql://db/app");
    properties.setProperty("cdc.recovery-backoff-ms", "soon");

    CdcSettings.fromProperties(properties);
  }

  private static Properties load() {
    Properties properties = new Properties();
    try (InputStream in = CdcSettings.class.getResourceAsStream(CdcSettings.RESOURCE)) {
      properties.load(in);
    } catch (Exception e) {
      throw new AssertionError(e);
    }
    return properties;
  }
}
