package dev.solvix.chatclient;

import dev.solvix.chatclient.config.ChatProperties;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "Solvix Chat Client",
    sharedModules = {"config", "model", "util"})
@EnableConfigurationProperties(ChatProperties.class)
public class SolvixChatClientApp {

  public static void main(String[] args) {
    new SpringApplicationBuilder(SolvixChatClientApp.class)
        .web(WebApplicationType.NONE)
        .run(args);
  }
}
