package com.focus.gate.session;

public interface EnforcementLauncher {

    EnforcementHandle launch();
}
