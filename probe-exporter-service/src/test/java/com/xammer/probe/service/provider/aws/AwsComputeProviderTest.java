package com.xammer.probe.service.provider.aws;

import com.xammer.probe.service.probe.ScrapeDeadline;
import com.xammer.probe.service.provider.AddressHandle;
import com.xammer.probe.service.provider.InstanceStatus;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.Address;
import software.amazon.awssdk.services.ec2.model.DescribeAddressesResponse;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.DisassociateAddressRequest;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.InstanceState;
import software.amazon.awssdk.services.ec2.model.InstanceStateName;
import software.amazon.awssdk.services.ec2.model.ReleaseAddressRequest;
import software.amazon.awssdk.services.ec2.model.Reservation;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings("unchecked")
class AwsComputeProviderTest {

    private final Ec2Client ec2 = mock(Ec2Client.class);
    private final AwsComputeProvider compute = new AwsComputeProvider(ec2,
            new AwsRequestGuard(ScrapeDeadline.after(Duration.ofSeconds(30), Clock.systemUTC())));

    @Test
    void associatedAddressIsDisassociatedBeforeRelease() {
        when(ec2.describeAddresses(any(Consumer.class))).thenReturn(DescribeAddressesResponse.builder()
                .addresses(Address.builder().allocationId("eipalloc-1").associationId("eipassoc-1").build())
                .build());

        compute.releaseAddress(new AddressHandle("eipalloc-1", "203.0.113.7"));

        InOrder order = inOrder(ec2);
        ArgumentCaptor<Consumer<DisassociateAddressRequest.Builder>> disassociate = ArgumentCaptor.forClass(Consumer.class);
        ArgumentCaptor<Consumer<ReleaseAddressRequest.Builder>> release = ArgumentCaptor.forClass(Consumer.class);
        order.verify(ec2).disassociateAddress(disassociate.capture());
        order.verify(ec2).releaseAddress(release.capture());

        DisassociateAddressRequest.Builder disassociateRequest = DisassociateAddressRequest.builder();
        disassociate.getValue().accept(disassociateRequest);
        assertThat(disassociateRequest.build().associationId()).isEqualTo("eipassoc-1");
        ReleaseAddressRequest.Builder releaseRequest = ReleaseAddressRequest.builder();
        release.getValue().accept(releaseRequest);
        assertThat(releaseRequest.build().allocationId()).isEqualTo("eipalloc-1");
    }

    @Test
    void unassociatedAddressIsReleasedDirectly() {
        when(ec2.describeAddresses(any(Consumer.class))).thenReturn(DescribeAddressesResponse.builder()
                .addresses(Address.builder().allocationId("eipalloc-2").build())
                .build());

        compute.releaseAddress(new AddressHandle("eipalloc-2", null));

        verify(ec2, never()).disassociateAddress(any(Consumer.class));
        verify(ec2).releaseAddress(any(Consumer.class));
    }

    @Test
    void instanceNotYetVisibleIsReportedAsPending() {
        AwsServiceException notFound = AwsServiceException.builder()
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("InvalidInstanceID.NotFound").build())
                .build();
        when(ec2.describeInstances(any(Consumer.class))).thenThrow(notFound);

        assertThat(compute.describeInstance("i-new").getState()).isEqualTo(InstanceStatus.State.PENDING);
    }

    @Test
    void runningInstanceCarriesItsPrivateAddress() {
        when(ec2.describeInstances(any(Consumer.class))).thenReturn(DescribeInstancesResponse.builder()
                .reservations(Reservation.builder().instances(Instance.builder()
                        .instanceId("i-1")
                        .state(InstanceState.builder().name(InstanceStateName.RUNNING).build())
                        .privateIpAddress("10.0.0.12")
                        .build()).build())
                .build());

        InstanceStatus status = compute.describeInstance("i-1");

        assertThat(status.getState()).isEqualTo(InstanceStatus.State.RUNNING);
        assertThat(status.getPrivateIp()).isEqualTo("10.0.0.12");
    }
}
