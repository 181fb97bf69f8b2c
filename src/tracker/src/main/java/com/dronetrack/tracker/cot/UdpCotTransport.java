package com.dronetrack.tracker.cot;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.MulticastSocket;
import java.net.UnknownHostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sends each CoT event as a single UDP datagram, to a unicast or multicast group address. */
public class UdpCotTransport implements CotTransport {
  private static final Logger LOGGER = LoggerFactory.getLogger(UdpCotTransport.class);

  private final InetSocketAddress destination;
  private final DatagramSocket socket;

  public UdpCotTransport(String host, int port, int multicastTtl) {
    try {
      InetAddress address = InetAddress.getByName(host);
      this.destination = new InetSocketAddress(address, port);
      if (address.isMulticastAddress()) {
        MulticastSocket multicast = new MulticastSocket();
        multicast.setTimeToLive(multicastTtl);
        this.socket = multicast;
      } else {
        this.socket = new DatagramSocket();
      }
    } catch (UnknownHostException ex) {
      throw new IllegalStateException("Cannot resolve CoT host " + host, ex);
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot open CoT socket", ex);
    }
    LOGGER.info("CoT transport sending to {}", destination);
  }

  @Override
  public void sendEvent(byte[] event) {
    try {
      socket.send(new DatagramPacket(event, event.length, destination));
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to send CoT event to " + destination, ex);
    }
  }

  @Override
  public void close() {
    socket.close();
  }

  InetSocketAddress destination() {
    return destination;
  }

  boolean isMulticast() {
    return socket instanceof MulticastSocket;
  }
}
