package io.github.themoah.kreg;

import io.github.themoah.kreg.config.VertxConfig;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launcher for kreg. Routes Vert.x logging to SLF4J and deploys the main verticle.
 */
public class KregLauncher {

  private static final Logger log = LoggerFactory.getLogger(KregLauncher.class);

  public static void main(String[] args) {
    System.setProperty("vertx.logger-delegate-factory-class-name",
      "io.vertx.core.logging.SLF4JLogDelegateFactory");

    VertxOptions vertxOptions = VertxConfig.createVertxOptions();
    Vertx vertx = Vertx.vertx(vertxOptions);

    DeploymentOptions deploymentOptions = VertxConfig.createDeploymentOptions();

    vertx.deployVerticle(new MainVerticle(), deploymentOptions)
      .onSuccess(id -> log.info("MainVerticle deployed with ID: {}", id))
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        vertx.close();
        System.exit(1);
      });

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      log.info("Shutdown requested, closing Vert.x");
      vertx.close().toCompletionStage().toCompletableFuture().join();
    }, "kreg-shutdown"));
  }
}
