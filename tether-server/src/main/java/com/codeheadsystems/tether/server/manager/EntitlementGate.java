package com.codeheadsystems.tether.server.manager;

import com.codeheadsystems.tether.server.model.Role;

/**
 * Decides whether a role meets a page's minimum role.
 * <p>
 * Unknown required levels rank as {@link Role#SUPERADMIN} and unknown current roles rank as
 * {@link Role#PUBLIC}, so a typo never grants access.
 */
public class EntitlementGate {

  /**
   * Rank of a required level name; unknown names rank highest.
   */
  public int requiredRank(String requiredLevel) {
    return Role.fromName(requiredLevel).map(Role::rank).orElse(Role.SUPERADMIN.rank());
  }

  /**
   * Rank of a current role name; unknown or missing names rank lowest.
   */
  public int currentRank(String currentRole) {
    return Role.fromName(currentRole).map(Role::rank).orElse(Role.PUBLIC.rank());
  }

  public boolean hasAccess(String currentRole, String requiredLevel) {
    if (Role.fromName(requiredLevel).filter(r -> r == Role.PUBLIC).isPresent()) {
      return true;
    }
    return currentRank(currentRole) >= requiredRank(requiredLevel);
  }

  public boolean hasAccess(Role currentRole, String requiredLevel) {
    return hasAccess(currentRole == null ? null : currentRole.wireName(), requiredLevel);
  }
}
