// Copyright (c) 2024 VMware, Inc. or its affiliates.  All rights reserved.
//
// This software, the RabbitMQ AMQP 1.0 topic producer, is dual-licensed under the
// Mozilla Public License 2.0 ("MPL"), and the Apache License version 2 ("ASL").
// For the MPL, please see LICENSE-MPL-RabbitMQ. For the ASL,
// please see LICENSE-APACHE2.
//
// This software is distributed on an "AS IS" basis, WITHOUT WARRANTY OF ANY KIND,
// either express or implied. See the LICENSE file for specific language governing
// rights and limitations of this software.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.amqp.producer.impl;

import static java.util.concurrent.TimeUnit.SECONDS;

import com.rabbitmq.amqp.producer.EventBatch;
import com.rabbitmq.amqp.producer.Proactor;
import com.rabbitmq.amqp.producer.ProducerException;
import com.rabbitmq.amqp.producer.ProtocolEvent;
import com.rabbitmq.amqp.producer.impl.Utils.NamedThreadFactory;
import com.rabbitmq.amqp.producer.metrics.MetricsCollector;
import com.rabbitmq.amqp.producer.metrics.NoOpMetricsCollector;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.qpid.proton.Proton;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.amqp.transport.ErrorCondition;
import org.apache.qpid.proton.engine.Collector;
import org.apache.qpid.proton.engine.Connection;
import org.apache.qpid.proton.engine.EndpointState;
import org.apache.qpid.proton.engine.Event;
import org.apache.qpid.proton.engine.Transport;
import org.apache.qpid.proton.engine.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Proactor} on top of a Netty channel.
 *
 * <p>Netty threads only copy inbound bytes and connection status changes into a queue. The
 * event loop thread feeds them to the Proton-J transport in {@link #waitEvents()}, processes
 * the resulting engine events and writes the transport output back after each inbound chunk
 * and in {@link #done(EventBatch)}.
 */
public final class NettyProactor implements Proactor {

  static final Symbol IO_ERROR = Symbol.valueOf("proton:io");

  private static final Logger LOGGER = LoggerFactory.getLogger(NettyProactor.class);

  private final BlockingQueue<IoSignal> signals = new LinkedBlockingQueue<>();
  private final MetricsCollector metricsCollector;
  private final Duration connectTimeout;
  private final Runnable nettyClosing = Utils.makeIdempotent(this::closeNetty);

  private EventLoopGroup eventLoopGroup;
  private Connection connection;
  private Transport transport;
  private Collector collector;
  private Channel channel;
  private boolean transportClosed = false;
  private boolean inactiveDelivered = false;

  public NettyProactor() {
    this(NoOpMetricsCollector.SINGLETON, Duration.ofSeconds(30));
  }

  public NettyProactor(MetricsCollector metricsCollector, Duration connectTimeout) {
    this.metricsCollector = metricsCollector;
    this.connectTimeout = connectTimeout;
  }

  @Override
  public void connect(String host, int port, Connection connection, Transport transport) {
    if (this.connection != null) {
      throw new IllegalStateException("Proactor already connected");
    }
    this.connection = connection;
    this.transport = transport;
    this.collector = Proton.collector();
    connection.setHostname(host);
    connection.collect(this.collector);
    transport.bind(connection);

    this.eventLoopGroup = new NioEventLoopGroup(1, new NamedThreadFactory("amqp-producer-io-"));
    Bootstrap b = new Bootstrap();
    b.group(this.eventLoopGroup);
    b.channel(NioSocketChannel.class);
    b.option(ChannelOption.TCP_NODELAY, true);
    b.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) this.connectTimeout.toMillis());
    b.handler(
        new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) {
            ch.pipeline().addLast(new AmqpHandler());
          }
        });
    LOGGER.debug("Connecting to {}:{}", host, port);
    b.connect(host, port)
        .addListener(
            (ChannelFutureListener)
                future -> {
                  if (future.isSuccess()) {
                    signals.add(IoSignal.connected(future.channel()));
                  } else {
                    signals.add(IoSignal.error(future.cause()));
                  }
                });
  }

  @Override
  public EventBatch waitEvents() {
    if (this.collector == null) {
      throw new IllegalStateException("Proactor not connected");
    }
    while (this.collector.peek() == null && !inactivePending()) {
      if (this.transportClosed) {
        throw new ProducerException("No more events, the connection is gone");
      }
      try {
        apply(this.signals.take());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new ProducerException("Interrupted while waiting for events", e);
      }
      IoSignal signal;
      while ((signal = this.signals.poll()) != null) {
        apply(signal);
      }
    }
    return new CollectorBatch();
  }

  @Override
  public void done(EventBatch batch) {
    flush();
  }

  @Override
  public void close() {
    this.nettyClosing.run();
  }

  private boolean inactivePending() {
    return this.transportClosed && !this.inactiveDelivered;
  }

  private void apply(IoSignal signal) {
    switch (signal.type) {
      case CONNECTED:
        LOGGER.debug("Connected to {}", signal.channel.remoteAddress());
        this.channel = signal.channel;
        flush();
        break;
      case DATA:
        this.metricsCollector.readBytes(signal.data.length);
        feed(signal.data);
        // the engine can have output to send without posting any event, e.g. after SASL
        flush();
        break;
      case ERROR:
        LOGGER.warn("I/O error: {}", signal.cause.getMessage());
        if (this.transport.getCondition() == null) {
          this.transport.setCondition(
              new ErrorCondition(IO_ERROR, String.valueOf(signal.cause.getMessage())));
        }
        closeChannel();
        closeTransport();
        break;
      case INACTIVE:
        LOGGER.debug("Netty channel became inactive");
        if (this.transport.getCondition() == null
            && this.connection.getRemoteState() != EndpointState.CLOSED) {
          this.transport.setCondition(new ErrorCondition(IO_ERROR, "connection aborted"));
        }
        closeTransport();
        break;
      default:
        throw new IllegalStateException("Unknown I/O signal: " + signal.type);
    }
  }

  private void feed(byte[] data) {
    int offset = 0;
    while (offset < data.length) {
      int capacity = this.transport.capacity();
      if (capacity <= 0) {
        LOGGER.debug("Transport input closed, dropping {} byte(s)", data.length - offset);
        return;
      }
      int length = Math.min(capacity, data.length - offset);
      this.transport.tail().put(data, offset, length);
      offset += length;
      try {
        this.transport.process();
      } catch (TransportException e) {
        // the transport keeps the error as its condition
        LOGGER.debug("Error while processing input: {}", e.getMessage());
      }
    }
  }

  private void flush() {
    if (this.channel == null || this.transportClosed) {
      return;
    }
    int pending = this.transport.pending();
    while (pending > 0) {
      ByteBuffer head = this.transport.head();
      int length = Math.min(pending, head.remaining());
      byte[] bytes = new byte[length];
      head.duplicate().get(bytes);
      this.transport.pop(length);
      ByteBuf buffer = Unpooled.wrappedBuffer(bytes);
      this.channel.writeAndFlush(buffer);
      this.metricsCollector.writtenBytes(length);
      pending = this.transport.pending();
    }
    if (pending < 0 || bothEndsClosed()) {
      closeChannel();
    }
  }

  private boolean bothEndsClosed() {
    return this.connection.getLocalState() == EndpointState.CLOSED
        && this.connection.getRemoteState() == EndpointState.CLOSED;
  }

  private void closeChannel() {
    if (this.channel != null && this.channel.isOpen()) {
      LOGGER.debug("Closing Netty channel");
      this.channel.close();
    } else if (this.channel == null) {
      // never connected, no inactive signal will come
      closeTransport();
    }
  }

  private void closeTransport() {
    if (!this.transportClosed) {
      this.transportClosed = true;
      try {
        this.transport.close_tail();
        // the engine posts TRANSPORT_CLOSED only once its output side is drained
        int pending = this.transport.pending();
        while (pending > 0) {
          this.transport.pop(pending);
          pending = this.transport.pending();
        }
        this.transport.close_head();
        this.transport.pending();
      } catch (TransportException e) {
        LOGGER.debug("Error while closing transport: {}", e.getMessage());
      }
    }
  }

  private void closeNetty() {
    try {
      if (this.channel != null && this.channel.isOpen()) {
        LOGGER.debug("Closing Netty channel");
        this.channel.close().get(10, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      LOGGER.info("Channel closing has been interrupted");
      Thread.currentThread().interrupt();
    } catch (ExecutionException e) {
      LOGGER.info("Channel closing failed", e);
    } catch (TimeoutException e) {
      LOGGER.info("Could not close channel in 10 seconds");
    }

    try {
      if (this.eventLoopGroup != null && !this.eventLoopGroup.isShuttingDown()) {
        LOGGER.debug("Closing Netty event loop group");
        this.eventLoopGroup.shutdownGracefully(1, 10, SECONDS).get(10, SECONDS);
      }
    } catch (InterruptedException e) {
      LOGGER.info("Event loop group closing has been interrupted");
      Thread.currentThread().interrupt();
    } catch (ExecutionException e) {
      LOGGER.info("Event loop group closing failed", e);
    } catch (TimeoutException e) {
      LOGGER.info("Could not close event loop group in 10 seconds");
    }
  }

  private final class CollectorBatch implements EventBatch {

    private boolean engineEventOut = false;

    @Override
    public ProtocolEvent next() {
      if (this.engineEventOut) {
        collector.pop();
        this.engineEventOut = false;
      }
      Event event = collector.peek();
      if (event != null) {
        this.engineEventOut = true;
        return ProtocolEvent.of(event);
      } else if (inactivePending()) {
        inactiveDelivered = true;
        return ProtocolEvent.inactive(transport);
      } else {
        return null;
      }
    }
  }

  private class AmqpHandler extends ChannelInboundHandlerAdapter {

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
      ByteBuf m = (ByteBuf) msg;
      try {
        byte[] data = new byte[m.readableBytes()];
        m.readBytes(data);
        signals.add(IoSignal.data(data));
      } finally {
        m.release();
      }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
      signals.add(IoSignal.INACTIVE);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
      LOGGER.warn("Error in AMQP channel handler", cause);
      signals.add(IoSignal.error(cause));
      ctx.close();
    }
  }

  private static final class IoSignal {

    private static final IoSignal INACTIVE = new IoSignal(Type.INACTIVE, null, null, null);

    private final Type type;
    private final Channel channel;
    private final byte[] data;
    private final Throwable cause;

    private IoSignal(Type type, Channel channel, byte[] data, Throwable cause) {
      this.type = type;
      this.channel = channel;
      this.data = data;
      this.cause = cause;
    }

    static IoSignal connected(Channel channel) {
      return new IoSignal(Type.CONNECTED, channel, null, null);
    }

    static IoSignal data(byte[] data) {
      return new IoSignal(Type.DATA, null, data, null);
    }

    static IoSignal error(Throwable cause) {
      return new IoSignal(Type.ERROR, null, null, cause);
    }

    private enum Type {
      CONNECTED,
      DATA,
      ERROR,
      INACTIVE
    }
  }
}
