package com.neolms.studygroups.security;

import com.neolms.studygroups.model.Viewer;

import java.security.Principal;

/**
 * STOMP session principal. The name is the user id, which is what
 * {@code convertAndSendToUser} routes on.
 */
public class ViewerPrincipal implements Principal {

    private final Viewer viewer;

    public ViewerPrincipal(Viewer viewer) {
        this.viewer = viewer;
    }

    @Override
    public String getName() {
        return viewer.getUserId();
    }

    public Viewer getViewer() {
        return viewer;
    }

    @Override
    public String toString() {
        return "ViewerPrincipal{" + viewer.getUserId() + "}";
    }
}
