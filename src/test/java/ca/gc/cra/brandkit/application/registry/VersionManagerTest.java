package ca.gc.cra.brandkit.application.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class VersionManagerTest {

  @Test
  void impactSectionBumpsMinorAndKeepsPatch() {
    assertEquals("1.1.0", VersionManager.nextVersion("1.0.0", List.of("colors")));
    assertEquals("1.3.3", VersionManager.nextVersion("1.2.3", List.of("brand", "assets")));
  }

  @Test
  void otherSectionsLeaveVersionUnchanged() {
    assertEquals("1.0.0", VersionManager.nextVersion("1.0.0", List.of("brand", "layout", "metadata")));
  }

  @Test
  void customImpactSetIsHonoured() {
    assertEquals("2.1.0", VersionManager.nextVersion("2.0.0", List.of("brand"), Set.of("brand")));
  }

  @Test
  void malformedVersionResets() {
    assertEquals(VersionManager.RECOVERY_VERSION, VersionManager.bumpMinor("v1"));
    assertEquals(VersionManager.RECOVERY_VERSION, VersionManager.bumpMinor(null));
    assertEquals(VersionManager.RECOVERY_VERSION, VersionManager.bumpMinor("1.2"));
  }

  @Test
  void componentsBeyondLongRangeReset() {
    assertEquals(VersionManager.RECOVERY_VERSION, VersionManager.bumpMinor("1." + Long.MAX_VALUE + ".0"));
    assertEquals(VersionManager.RECOVERY_VERSION, VersionManager.bumpMinor("1.99999999999999999999.0"));
    assertEquals("1." + Long.MAX_VALUE + ".0", VersionManager.bumpMinor("1." + (Long.MAX_VALUE - 1) + ".0"));
  }
}
