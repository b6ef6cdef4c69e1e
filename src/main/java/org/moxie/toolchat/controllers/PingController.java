package org.moxie.toolchat.controllers;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

@ApplicationScoped
@Path("/v1/ping")
public class PingController {

  @GET
  @Produces(MediaType.TEXT_PLAIN)
  public String getPing() {
    return "PONG";
  }
}
