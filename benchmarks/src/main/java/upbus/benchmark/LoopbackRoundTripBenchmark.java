package upbus.benchmark;

import org.openjdk.jmh.annotations.*;
import upbus.UMessage;
import upbus.UPayload;
import upbus.UUri;
import upbus.network.NetworkTransport;
import upbus.network.loopback.LoopbackNetwork;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Measures network-path latency without a real network: encode -> loopback session ->
 * delivery thread -> decode -> listener callback.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar LoopbackRoundTripBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class LoopbackRoundTripBenchmark {

  private static final UUri TOPIC = new UUri("bench", 0xB00, 1, 0x8001);

  @Param({"100", "1000", "10000"})
  private int payloadSize;

  private LoopbackNetwork network;
  private NetworkTransport sender;
  private NetworkTransport receiver;
  private UPayload payload;
  private final AtomicReference<CountDownLatch> latchRef = new AtomicReference<>();

  @Setup(Level.Trial)
  public void setup() {
    network = new LoopbackNetwork();
    sender = NetworkTransport.builder("sender").sessionFactory(network.sessionFactory()).build();
    receiver = NetworkTransport.builder("receiver").sessionFactory(network.sessionFactory()).build();
    receiver.registerListener(TOPIC, msg -> {
      CountDownLatch latch = latchRef.get();
      if (latch != null) latch.countDown();
    });
    payload = UPayload.fromBytes(new byte[payloadSize]);
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    sender.close();
    receiver.close();
    network.close();
  }

  @Benchmark
  public void sendAndReceive() throws Exception {
    CountDownLatch latch = new CountDownLatch(1);
    latchRef.set(latch);
    sender.send(UMessage.publish(TOPIC).payload(payload).build());
    if (!latch.await(5, TimeUnit.SECONDS)) {
      throw new IllegalStateException("Message not delivered within 5s");
    }
  }
}
