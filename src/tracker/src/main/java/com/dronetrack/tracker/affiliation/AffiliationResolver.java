package com.dronetrack.tracker.affiliation;

/** Lookup contract for the trust classification of a drone UID. */
public interface AffiliationResolver {
  /**
   * Returns the affiliation configured for a UID.
   *
   * @param uid canonical drone id
   * @return configured affiliation, {@link Affiliation#UNKNOWN} when absent or on lookup failure
   */
  Affiliation resolve(String uid);
}
