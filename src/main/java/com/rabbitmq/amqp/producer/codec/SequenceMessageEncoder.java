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
package com.rabbitmq.amqp.producer.codec;

import static com.rabbitmq.amqp.producer.codec.OverflowRetry.retryOnOverflow;

import com.rabbitmq.amqp.producer.ProducerException;
import java.nio.BufferOverflowException;
import org.apache.qpid.proton.amqp.messaging.AmqpValue;
import org.apache.qpid.proton.message.Message;

/**
 * Builds and encodes the messages of a producer run.
 *
 * <p>Each message has an AMQP value body with the string {@code sequence_<n>} and the durable
 * header flag set. Messages are encoded in the {@link EncodeBuffer} of the session, which grows
 * until the message fits.
 */
public final class SequenceMessageEncoder {

  static final String BODY_PREFIX = "sequence_";

  private final EncodeBuffer buffer;

  public SequenceMessageEncoder(EncodeBuffer buffer) {
    this.buffer = buffer;
  }

  static String body(int sequence) {
    return BODY_PREFIX + sequence;
  }

  static Message message(int sequence) {
    Message message = Message.Factory.create();
    message.setBody(new AmqpValue(body(sequence)));
    message.setDurable(true);
    return message;
  }

  /**
   * Encodes the message with the given sequence number.
   *
   * <p>The returned message points to the array of the encode buffer, it is valid only until
   * the next call.
   *
   * @param sequence the sequence number
   * @return the encoded message
   * @throws ProducerException if the message cannot be encoded
   */
  public EncodedMessage encode(int sequence) {
    Message message = message(sequence);
    int size;
    try {
      size =
          retryOnOverflow(
              () -> encodeInBuffer(message),
              () -> buffer.ensureCapacity(buffer.capacity() + 1));
    } catch (ProducerException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ProducerException("Error encoding message for sequence " + sequence, e);
    }
    return new EncodedMessage(size, buffer.array());
  }

  private int encodeInBuffer(Message message) throws BufferOverflowException {
    byte[] array = buffer.array();
    return message.encode(array, 0, array.length);
  }

  public static final class EncodedMessage {

    private final int size;
    private final byte[] data;

    EncodedMessage(int size, byte[] data) {
      this.size = size;
      this.data = data;
    }

    public int getSize() {
      return size;
    }

    public byte[] getData() {
      return data;
    }
  }
}
