/** Ports chat sessions use to reach the user. */
@NamedInterface("api")
package dev.solvix.chatclient.app.api;

import org.springframework.modulith.NamedInterface;
