@NamedInterface("session")
package dev.solvix.chatclient.app.core;

import org.springframework.modulith.NamedInterface;
