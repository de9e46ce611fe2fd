package upbus.benchmark;

import org.openjdk.jmh.annotations.*;
import upbus.LocalTransport;
import upbus.UListener;
import upbus.UMessage;
import upbus.UPayload;
import upbus.UUri;

import java.util.concurrent.TimeUnit;

/**
 * Measures synchronous in-process delivery: send -> registry snapshot -> listener callbacks.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar LocalTransportDispatchBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class LocalTransportDispatchBenchmark {

  private static final UUri TOPIC = new UUri("bench", 0xB00, 1, 0x8001);

  @Param({"1", "10", "100"})
  private int listenerCount;

  @Param({"16", "1024"})
  private int payloadSize;

  private LocalTransport transport;
  private UMessage message;
  private volatile UMessage lastDelivered;

  @Setup(Level.Trial)
  public void setup() {
    transport = new LocalTransport();
    for (int i = 0; i < listenerCount; i++) {
      transport.registerListener(TOPIC, new Sink());
    }
    message = UMessage.publish(TOPIC).payload(UPayload.fromBytes(new byte[payloadSize])).build();
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    transport.close();
  }

  @Benchmark
  public void send() {
    transport.send(message);
  }

  @Benchmark
  public UMessage buildAndSend() {
    UMessage fresh = UMessage.publish(TOPIC).payload(UPayload.fromBytes(new byte[payloadSize])).build();
    transport.send(fresh);
    return fresh;
  }

  // one instance per registration; identical listeners would be collapsed
  private final class Sink implements UListener {
    @Override
    public void onReceive(UMessage msg) {
      lastDelivered = msg;
    }
  }
}
