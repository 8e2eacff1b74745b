package com.fillbot.hft.account;

import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.domain.OrderNode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class FillMetadataResolver {

  private final @NonNull AccountDirectory accounts;

  public FillMetadata resolve(FillCandidate candidate) {
    MakerInfo makerInfo = null;
    if (candidate.hasMaker()) {
      OrderNode maker = candidate.makerNode().orElseThrow();
      String makerAuthority = accounts.mustGetUser(maker.accountRef()).authority();
      String makerStats = accounts.mustGetStats(makerAuthority).statsAccount();
      makerInfo = new MakerInfo(maker.accountRef(), maker.order(), makerStats);
    }

    UserAccount taker = accounts.mustGetUser(candidate.accountRef());
    ReferrerInfo referrerInfo = accounts.mustGetStats(taker.authority()).referrerInfo();
    return new FillMetadata(makerInfo, taker, referrerInfo);
  }
}
